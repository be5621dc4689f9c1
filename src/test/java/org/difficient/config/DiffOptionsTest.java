package org.difficient.config;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.URISyntaxException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DiffOptionsTest {

    @Test
    void defaults_matchReferenceConf() {
        DiffOptions options = DiffOptions.defaults();

        assertThat(options.maxLcsCells()).isEqualTo(16_777_216L);
        assertThat(options.failFast()).isFalse();
        assertThat(DiffOptions.defaults()).isSameAs(options);
    }

    @Test
    void fromConfig_readsBothPaths() throws URISyntaxException {
        File file = new File(getClass().getResource("/test-config.conf").toURI());

        DiffOptions options = DiffOptions.fromConfig(ConfigLoader.loadFromFile(file));

        assertThat(options).isEqualTo(new DiffOptions(64, true));
    }

    @Test
    void fromConfig_outOfRangeValue_isRejected() throws URISyntaxException {
        File file = new File(getClass().getResource("/invalid-config.conf").toURI());

        assertThatThrownBy(() -> DiffOptions.fromConfig(ConfigLoader.loadFromFile(file)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxLcsCells must be >= 1");
    }

    @Test
    void fromConfig_parsedString() {
        DiffOptions options = DiffOptions.fromConfig(ConfigFactory.parseString(
                "difficient { sequence.max-lcs-cells = 10, patch.fail-fast = true }"));

        assertThat(options.maxLcsCells()).isEqualTo(10L);
        assertThat(options.failFast()).isTrue();
    }

    @Test
    void constructor_rejectsValuesBeyondIntRange() {
        assertThatThrownBy(() -> new DiffOptions(Integer.MAX_VALUE + 1L, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withers_copyTheOtherSetting() {
        DiffOptions base = new DiffOptions(100, false);

        assertThat(base.withFailFast(true)).isEqualTo(new DiffOptions(100, true));
        assertThat(base.withMaxLcsCells(7)).isEqualTo(new DiffOptions(7, false));
    }
}
