package im.arun.tiki.parser;

import im.arun.tiki.exception.TikiSyntaxException;
import im.arun.tiki.model.ConceptNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HierarchyBuilder Tests")
class HierarchyBuilderTest {

    private HierarchyBuilder builder;

    @BeforeEach
    void setUp() throws Exception {
        builder = new HierarchyBuilder();
        builder.createRoot("Root", Map.of(), 1, "Root");
    }

    private ConceptNode create(int level, String title) throws TikiSyntaxException {
        return builder.create(level, title, Map.of(), 0, title);
    }

    @Test
    @DisplayName("should attach each node to the most recent node one level up")
    void shouldAttachToNearestAncestor() throws Exception {
        ConceptNode a = create(1, "A");
        ConceptNode a1 = create(2, "A1");
        ConceptNode deep = create(3, "Deep");
        ConceptNode a2 = create(2, "A2");
        ConceptNode b = create(1, "B");

        assertThat(deep.getId()).isEqualTo("*1**1***1");
        assertThat(a2.getId()).isEqualTo("*1**2");
        assertThat(b.getId()).isEqualTo("*2");
        assertThat(a.getChildren()).containsExactly(a1, a2);
        assertThat(a1.getChildren()).containsExactly(deep);
        assertThat(builder.getRoot().getChildren()).containsExactly(a, b);
    }

    @Test
    @DisplayName("should restart deeper numbering under a new parent")
    void shouldResetDeeperCounters() throws Exception {
        create(1, "A");
        create(2, "A1");
        create(3, "A1a");
        create(1, "B");
        ConceptNode b1 = create(2, "B1");
        ConceptNode b1a = create(3, "B1a");

        assertThat(b1.getId()).isEqualTo("*2**1");
        assertThat(b1a.getId()).isEqualTo("*2**1***1");
    }

    @Test
    @DisplayName("should support nesting deeper than ten levels")
    void shouldSupportDeepNesting() throws Exception {
        ConceptNode node = null;
        for (int level = 1; level <= 12; level++) {
            node = create(level, "L" + level);
        }

        assertThat(node.getDepth()).isEqualTo(12);
        assertThat(node.getId()).endsWith("************1");
    }

    @Test
    @DisplayName("should reject a second root")
    void shouldRejectSecondRoot() {
        assertThatThrownBy(() -> builder.createRoot("Again", Map.of(), 4, "Again"))
            .isInstanceOfSatisfying(TikiSyntaxException.class, e -> {
                assertThat(e.getReason()).isEqualTo(HierarchyBuilder.MULTIPLE_ROOTS);
                assertThat(e.getLineNumber()).isEqualTo(4);
            });
    }

    @Test
    @DisplayName("should reject concepts before a root exists")
    void shouldRejectConceptWithoutRoot() {
        HierarchyBuilder empty = new HierarchyBuilder();

        assertThatThrownBy(() -> empty.create(1, "A", Map.of(), 1, "* A"))
            .isInstanceOfSatisfying(TikiSyntaxException.class,
                e -> assertThat(e.getReason()).isEqualTo(HierarchyBuilder.ROOT_REQUIRED));
    }

    @Test
    @DisplayName("should reject skipped levels")
    void shouldRejectSkippedLevel() throws Exception {
        create(1, "A");

        assertThatThrownBy(() -> create(3, "C"))
            .isInstanceOf(TikiSyntaxException.class)
            .hasMessageContaining("found level 3, expected at most 2");
    }
}
