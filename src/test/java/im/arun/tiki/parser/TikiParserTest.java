package im.arun.tiki.parser;

import im.arun.tiki.config.TikiConfig;
import im.arun.tiki.exception.TikiFileAccessException;
import im.arun.tiki.exception.TikiSyntaxException;
import im.arun.tiki.model.ConceptNode;
import im.arun.tiki.model.MetadataValue;
import im.arun.tiki.model.TikiDocument;
import im.arun.tiki.util.TreeUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

@DisplayName("TikiParser Tests")
class TikiParserTest {

    private TikiParser parser;

    @BeforeEach
    void setUp() {
        parser = new TikiParser(new TikiConfig());
    }

    private static String lines(String... lines) {
        return String.join("\n", lines);
    }

    private static List<String> ids(TikiDocument document) {
        return TreeUtils.preOrder(document.getRoot()).stream()
            .map(ConceptNode::getId)
            .collect(Collectors.toList());
    }

    @Test
    @DisplayName("should number concepts per level and reset deeper counters")
    void shouldNumberConcepts_andResetDeeperCounters() throws Exception {
        TikiDocument document = parser.parse(lines(
            "Root",
            "* A",
            "** A1",
            "** A2",
            "* B",
            "** B1"));

        assertThat(ids(document)).containsExactly("", "*1", "*1**1", "*1**2", "*2", "*2**1");
        ConceptNode root = document.getRoot();
        assertThat(root.isRoot()).isTrue();
        assertThat(root.getChildren()).extracting(ConceptNode::getTitle).containsExactly("A", "B");
        assertThat(root.getChildren().get(0).getChildren()).extracting(ConceptNode::getTitle)
            .containsExactly("A1", "A2");
    }

    @Test
    @DisplayName("should read numbered marker groups as nesting levels")
    void shouldReadNumberedMarkers() throws Exception {
        TikiDocument document = parser.parse(lines(
            "Root",
            "*1 A",
            "*1**1 A1",
            "*1**1***1 Deep",
            "*1**2 A2",
            "*2 B"));

        assertThat(ids(document)).containsExactly("", "*1", "*1**1", "*1**1***1", "*1**2", "*2");
        assertThat(TreeUtils.maxDepth(document.getRoot())).isEqualTo(3);
    }

    @Test
    @DisplayName("should derive the same ids for documents with the same structure")
    void shouldDeriveSameIds_forSameStructure() throws Exception {
        TikiDocument first = parser.parse(lines("One", "* a", "** b", "* c"));
        TikiDocument second = new TikiParser().parse(lines("Other", "* x", "** y", "* z"));

        assertThat(ids(first)).isEqualTo(ids(second));
    }

    @Test
    @DisplayName("should start from fresh state on every parse")
    void shouldResetState_betweenParses() throws Exception {
        String text = lines("Root", "* A", "* B");

        assertThat(ids(parser.parse(text))).isEqualTo(ids(parser.parse(text)));
    }

    @Test
    @DisplayName("should reject a level skip on the offending line")
    void shouldRejectLevelSkip() {
        assertThatThrownBy(() -> parser.parse(lines("Root", "* A", "*** C")))
            .isInstanceOfSatisfying(TikiSyntaxException.class, e -> {
                assertThat(e.getLineNumber()).isEqualTo(3);
                assertThat(e.getLineContent()).isEqualTo("*** C");
                assertThat(e.getReason()).contains("Invalid level jump");
            });
    }

    @Test
    @DisplayName("should reject an empty concept title on that exact line")
    void shouldRejectEmptyTitle() {
        assertThatThrownBy(() -> parser.parse(lines("Root", "* A", "** ")))
            .isInstanceOfSatisfying(TikiSyntaxException.class, e -> {
                assertThat(e.getLineNumber()).isEqualTo(3);
                assertThat(e.getReason()).isEqualTo(HierarchyBuilder.EMPTY_TITLE);
                assertThat(e.getLineContent()).isEqualTo("** ");
            });
    }

    @Test
    @DisplayName("should treat a marker run without a title as description text")
    void shouldKeepHorizontalRule_inDescription() throws Exception {
        TikiDocument document = parser.parse(lines(
            "Root",
            "* A",
            "Some text",
            "***",
            "More text",
            "*1**2",
            "* B"));

        ConceptNode a = document.getRoot().getChildren().get(0);
        assertThat(a.getDescription()).isEqualTo("Some text\n***\nMore text\n*1**2");
        assertThat(a.hasChildren()).isFalse();
        assertThat(ids(document)).containsExactly("", "*1", "*2");
    }

    @Test
    @DisplayName("should reject a marker run before the root")
    void shouldRejectMarkerRun_beforeRoot() {
        assertThatThrownBy(() -> parser.parse(lines("***", "Root")))
            .isInstanceOfSatisfying(TikiSyntaxException.class, e -> {
                assertThat(e.getLineNumber()).isEqualTo(1);
                assertThat(e.getReason()).isEqualTo(HierarchyBuilder.ROOT_REQUIRED);
            });
    }

    @Test
    @DisplayName("should reject a title made only of metadata")
    void shouldRejectTitleOfOnlyMetadata() {
        assertThatThrownBy(() -> parser.parse(lines("Root", "* [status: done]")))
            .isInstanceOfSatisfying(TikiSyntaxException.class,
                e -> assertThat(e.getLineNumber()).isEqualTo(2));
    }

    @Test
    @DisplayName("should require an unmarked root line")
    void shouldRequireUnmarkedRoot() {
        assertThatThrownBy(() -> parser.parse(lines("* Not a root", "** child")))
            .isInstanceOfSatisfying(TikiSyntaxException.class, e -> {
                assertThat(e.getLineNumber()).isEqualTo(1);
                assertThat(e.getReason()).isEqualTo(HierarchyBuilder.ROOT_REQUIRED);
            });

        assertThatThrownBy(() -> parser.parse(lines("", "*emphasis*")))
            .isInstanceOfSatisfying(TikiSyntaxException.class,
                e -> assertThat(e.getLineNumber()).isEqualTo(2));
    }

    @Test
    @DisplayName("should fail when no concept is found")
    void shouldFail_whenNoConcepts() {
        assertThatThrownBy(() -> parser.parse(lines("", "   ", "")))
            .isInstanceOfSatisfying(TikiSyntaxException.class,
                e -> assertThat(e.getReason()).isEqualTo(TikiParser.NO_CONCEPTS));
    }

    @Test
    @DisplayName("should collect descriptions and keep interior blank lines")
    void shouldCollectDescriptions() throws Exception {
        TikiDocument document = parser.parse(lines(
            "Root",
            "Overview of the root.",
            "* A",
            "",
            "",
            "First line",
            "",
            "  Indented second line",
            "   ",
            "* B"));

        ConceptNode root = document.getRoot();
        assertThat(root.getDescription()).isEqualTo("Overview of the root.");
        assertThat(root.getChildren().get(0).getDescription()).isEqualTo("First line\n\n  Indented second line");
        assertThat(root.getChildren().get(1).getDescription()).isEmpty();
    }

    @Test
    @DisplayName("should strip metadata annotations from titles")
    void shouldParseInlineMetadata() throws Exception {
        TikiDocument document = parser.parse(lines(
            "Root",
            "* Task [priority: high, mastery: 85%, blocked]",
            "* Other [see: *1] [count=3]"));

        ConceptNode task = document.getRoot().getChildren().get(0);
        assertThat(task.getTitle()).isEqualTo("Task");
        assertThat(task.getMetadata()).containsExactly(
            entry("priority", MetadataValue.ofString("high")),
            entry("mastery", MetadataValue.ofFloat(0.85)),
            entry("blocked", MetadataValue.ofBoolean(true)));

        ConceptNode other = document.getRoot().getChildren().get(1);
        assertThat(other.getTitle()).isEqualTo("Other");
        assertThat(other.getMetadata()).containsExactly(
            entry("see", MetadataValue.ofReference("*1")),
            entry("count", MetadataValue.ofInteger(3)));
    }

    @Test
    @DisplayName("should expose frontmatter as document metadata")
    void shouldParseFrontmatter() throws Exception {
        TikiDocument document = parser.parse(lines(
            "---",
            "title: Demo",
            "version: 2",
            "---",
            "Root",
            "* A"));

        assertThat(document.getFrontmatter())
            .containsEntry("title", "Demo")
            .containsEntry("version", 2);
        assertThat(document.getRoot().getTitle()).isEqualTo("Root");
        assertThat(ids(document)).containsExactly("", "*1");
    }

    @Test
    @DisplayName("should treat delimiters past the frontmatter line limit as description")
    void shouldHonourFrontmatterLineLimit() throws Exception {
        String text = lines("Root", "* A", "---", "key: v", "---");

        TikiDocument withDefaults = parser.parse(text);
        assertThat(withDefaults.getFrontmatter()).containsEntry("key", "v");
        assertThat(withDefaults.getRoot().getChildren().get(0).getDescription()).isEmpty();

        TikiConfig config = new TikiConfig();
        config.setFrontmatterLineLimit(2);
        TikiDocument limited = new TikiParser(config).parse(text);
        assertThat(limited.getFrontmatter()).isEmpty();
        assertThat(limited.getRoot().getChildren().get(0).getDescription()).isEqualTo("---\nkey: v\n---");
    }

    @Test
    @DisplayName("should ignore frontmatter that is not a YAML mapping")
    void shouldIgnoreInvalidFrontmatter() throws Exception {
        TikiDocument document = parser.parse(lines("---", "- just", "- a list", "---", "Root"));

        assertThat(document.getFrontmatter()).isEmpty();
        assertThat(document.getRoot().getTitle()).isEqualTo("Root");
    }

    @Test
    @DisplayName("should keep code blocks verbatim in descriptions")
    void shouldKeepCodeBlocksVerbatim() throws Exception {
        TikiDocument document = parser.parse(lines(
            "Root",
            "* A",
            "```java",
            "** not a concept",
            "",
            "int x = 1;",
            "```",
            "* B"));

        ConceptNode a = document.getRoot().getChildren().get(0);
        assertThat(a.getDescription()).isEqualTo("```java\n** not a concept\n\nint x = 1;\n```");
        assertThat(a.getChildren()).isEmpty();
        assertThat(document.getRoot().getChildren()).hasSize(2);
    }

    @Test
    @DisplayName("should honour a configured code fence token")
    void shouldHonourConfiguredFence() throws Exception {
        TikiConfig config = new TikiConfig();
        config.setCodeFence("~~~");
        TikiDocument document = new TikiParser(config).parse(lines("Root", "* A", "~~~", "* inside", "~~~"));

        assertThat(document.getRoot().getChildren()).hasSize(1);
        assertThat(document.getRoot().getChildren().get(0).getDescription()).isEqualTo("~~~\n* inside\n~~~");
    }

    @Test
    @DisplayName("should strip carriage returns from CRLF input")
    void shouldHandleCrlf() throws Exception {
        TikiDocument document = parser.parse("Root\r\n* A\r\nText\r\n");

        assertThat(document.getRoot().getTitle()).isEqualTo("Root");
        assertThat(document.getRoot().getChildren().get(0).getTitle()).isEqualTo("A");
        assertThat(document.getRoot().getChildren().get(0).getDescription()).isEqualTo("Text");
    }

    @Test
    @DisplayName("should parse from a reader")
    void shouldParseFromReader() throws Exception {
        TikiDocument document = parser.parse(new StringReader("Root\n* A\n"), "inline");

        assertThat(document.getName()).isEqualTo("inline");
        assertThat(ids(document)).containsExactly("", "*1");
    }

    @Test
    @DisplayName("should parse a UTF-8 file")
    void shouldParseFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("spec.tiki");
        Files.writeString(file, lines("Résumé", "* Überblick"), StandardCharsets.UTF_8);

        TikiDocument document = parser.parseFile(file);

        assertThat(document.getName()).isEqualTo("spec.tiki");
        assertThat(document.getRoot().getChildren().get(0).getTitle()).isEqualTo("Überblick");
    }

    @Test
    @DisplayName("should report missing and undecodable files as access errors")
    void shouldReportFileAccessErrors(@TempDir Path dir) throws Exception {
        assertThatThrownBy(() -> parser.parseFile(dir.resolve("missing.tiki")))
            .isInstanceOf(TikiFileAccessException.class)
            .hasMessageContaining("File not found");

        Path binary = dir.resolve("binary.tiki");
        Files.write(binary, new byte[] {'R', 'o', 'o', 't', '\n', (byte) 0xC3, (byte) 0x28});
        assertThatThrownBy(() -> parser.parseFile(binary))
            .isInstanceOf(TikiFileAccessException.class)
            .hasMessageContaining("encoding");
    }

    @Test
    @DisplayName("should count asterisk groups to find the level")
    void shouldComputeLevelFromMarkers() {
        assertThat(TikiParser.levelOf("*")).isEqualTo(1);
        assertThat(TikiParser.levelOf("***")).isEqualTo(3);
        assertThat(TikiParser.levelOf("**2")).isEqualTo(2);
        assertThat(TikiParser.levelOf("*1**2")).isEqualTo(2);
        assertThat(TikiParser.levelOf("*1**2***3")).isEqualTo(3);
    }
}
