package org.difficient.core;

import org.difficient.api.Differ;
import org.difficient.api.delta.Delta;
import org.difficient.api.patch.PatchException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Assembles differs through the {@link Differs} facade, including a recursive type.
 */
@Tag("unit")
class DiffersTest {

    record Team(String name, List<String> members, Map<String, Integer> scores, Optional<String> motto) {}

    record Node(String label, List<Node> children) {}

    private static final Differ<Team> TEAMS = Differs.product(Team.class)
            .scalar("name", Team::name)
            .field("members", Team::members, Differs.list())
            .field("scores", Team::scores, Differs.map(Differs.scalar()))
            .field("motto", Team::motto, Differs.optional(Differs.scalar()))
            .build(v -> new Team(v.get("name"), v.get("members"), v.get("scores"), v.get("motto")));

    private static final Differ<Node> NODES = Differs.product(Node.class)
            .scalar("label", Node::label)
            .field("children", Node::children, Differs.list(Differs.lazy(() -> DiffersTest.NODES)))
            .build(v -> new Node(v.get("label"), v.get("children")));

    @Test
    void composedDiffer_roundTrips() throws PatchException {
        Map<String, Integer> scores = new LinkedHashMap<>();
        scores.put("ann", 3);
        scores.put("bob", 5);
        Team before = new Team("red", List.of("ann", "bob"), scores, Optional.empty());
        Team after = new Team("red", List.of("bob", "cid"), Map.of("bob", 6, "cid", 1), Optional.of("go"));

        Delta<Team> delta = TEAMS.diff(before, after);

        assertThat(((Delta.FieldsChanged<Team>) delta).fields()).containsOnlyKeys("members", "scores", "motto");
        assertThat(PatchEngine.patch(TEAMS, before, delta)).isEqualTo(after);
    }

    @Test
    void recursiveDiffer_roundTrips() throws PatchException {
        Node before = new Node("root", List.of(new Node("a", List.of()), new Node("b", List.of())));
        Node after = new Node("root", List.of(new Node("b", List.of(new Node("c", List.of())))));

        assertThat(PatchEngine.patch(NODES, before, NODES.diff(before, after))).isEqualTo(after);
    }

    @Test
    void lazyDiffer_nullSupplierResult_throws() {
        Differ<String> broken = Differs.lazy(() -> null);

        assertThatThrownBy(() -> broken.diff("a", "b")).isInstanceOf(IllegalStateException.class);
    }
}
