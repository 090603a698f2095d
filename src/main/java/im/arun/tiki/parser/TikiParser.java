package im.arun.tiki.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.tiki.config.TikiConfig;
import im.arun.tiki.exception.TikiException;
import im.arun.tiki.exception.TikiFileAccessException;
import im.arun.tiki.exception.TikiSyntaxException;
import im.arun.tiki.model.ConceptNode;
import im.arun.tiki.model.TikiDocument;
import im.arun.tiki.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented parser for Tiki documents.
 *
 * <p>A document starts with an unmarked root line, followed by concept lines whose leading
 * asterisk groups give their nesting level ({@code *}, {@code *1**2}, {@code ***}). Any other
 * line is description text for the most recent concept. An optional {@code ---} frontmatter
 * block near the top holds YAML document metadata, and fenced code blocks are copied into
 * descriptions verbatim.
 *
 * <p>Each call to {@code parse} uses fresh state, so instances can be reused and shared.
 */
public class TikiParser {
    private static final Logger logger = LoggerFactory.getLogger(TikiParser.class);

    private static final Pattern CONCEPT = Pattern.compile("^(\\*+\\S*)\\s+(.*)$");
    private static final Pattern FRONTMATTER = Pattern.compile("^---\\s*$");
    private static final char MARKER = '*';
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    static final String NO_CONCEPTS = "No valid concepts found";

    private final TikiConfig config;
    private final Pattern codeFence;
    private final MetadataParser metadataParser = new MetadataParser();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public TikiParser() {
        this(new TikiConfig());
    }

    public TikiParser(TikiConfig config) {
        this.config = config;
        this.codeFence = Pattern.compile("^" + Pattern.quote(config.getCodeFence()) + "(\\w+)?");
    }

    /**
     * Reads and parses a UTF-8 file.
     *
     * @throws TikiFileAccessException if the file is missing, unreadable or not valid UTF-8
     * @throws TikiSyntaxException if the content violates the document structure
     */
    public TikiDocument parseFile(Path path) throws TikiException {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new TikiFileAccessException("File not found", path.toString(), e);
        } catch (CharacterCodingException e) {
            throw new TikiFileAccessException("File encoding error", path.toString(), e);
        } catch (IOException e) {
            throw new TikiFileAccessException("Failed to read file", path.toString(), e);
        }

        TikiDocument document = parse(lines, path.getFileName().toString());
        logger.info("Parsed {}: {} concepts, max depth {}", path,
            TreeUtils.countConcepts(document.getRoot()), TreeUtils.maxDepth(document.getRoot()));
        return document;
    }

    public TikiDocument parse(Reader reader, String name) throws TikiException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader buffered = new BufferedReader(reader)) {
            String line;
            while ((line = buffered.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new TikiFileAccessException("Failed to read source", name, e);
        }
        return parse(lines, name);
    }

    public TikiDocument parse(String content) throws TikiSyntaxException {
        return parse(Arrays.asList(content.split("\n", -1)), null);
    }

    public TikiDocument parse(List<String> lines, String name) throws TikiSyntaxException {
        return new ParseRun(name).run(lines);
    }

    /**
     * Nesting level of a marker token. A token that is one asterisk run ({@code ***}, {@code **2})
     * has level equal to the run length; otherwise the level is the number of runs
     * ({@code *1**2***1} is 3).
     */
    static int levelOf(String markers) {
        int runs = 0;
        int firstRunLength = 0;
        boolean inRun = false;
        for (int i = 0; i < markers.length(); i++) {
            boolean marker = markers.charAt(i) == MARKER;
            if (marker && !inRun) {
                runs++;
            }
            if (marker && runs == 1) {
                firstRunLength++;
            }
            inRun = marker;
        }
        return runs == 1 ? firstRunLength : runs;
    }

    /**
     * State of a single parse.
     */
    private final class ParseRun {
        private final String name;
        private final HierarchyBuilder builder = new HierarchyBuilder();
        private final List<String> frontmatterLines = new ArrayList<>();
        private final List<String> pendingDescription = new ArrayList<>();
        private ScanState state = ScanState.NORMAL;
        private ConceptNode current;
        private int lineNumber;

        ParseRun(String name) {
            this.name = name;
        }

        TikiDocument run(List<String> lines) throws TikiSyntaxException {
            for (String rawLine : lines) {
                lineNumber++;
                String raw = rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
                processLine(raw, raw.stripTrailing());
            }

            if (state == ScanState.IN_CODE_BLOCK) {
                logger.warn("Unterminated code block at end of {}", describeSource());
            } else if (state == ScanState.IN_FRONTMATTER) {
                logger.warn("Unterminated frontmatter at end of {}", describeSource());
            }

            finalizeDescription();

            if (builder.getRoot() == null) {
                throw new TikiSyntaxException(NO_CONCEPTS, lineNumber, "");
            }
            return new TikiDocument(name, parseFrontmatter(), builder.getRoot());
        }

        private void processLine(String raw, String line) throws TikiSyntaxException {
            if (FRONTMATTER.matcher(line).matches()) {
                if (state == ScanState.NORMAL && lineNumber <= config.getFrontmatterLineLimit()) {
                    logger.debug("Frontmatter opened at line {}", lineNumber);
                    state = ScanState.IN_FRONTMATTER;
                    return;
                } else if (state == ScanState.IN_FRONTMATTER) {
                    logger.debug("Frontmatter closed at line {}", lineNumber);
                    state = ScanState.NORMAL;
                    return;
                }
            }

            if (state == ScanState.IN_FRONTMATTER) {
                frontmatterLines.add(line);
                return;
            }

            Matcher fence = codeFence.matcher(line);
            if (fence.lookingAt()) {
                if (state == ScanState.IN_CODE_BLOCK) {
                    state = ScanState.NORMAL;
                } else {
                    state = ScanState.IN_CODE_BLOCK;
                    logger.debug("Code block ({}) opened at line {}",
                        fence.group(1) != null ? fence.group(1) : "text", lineNumber);
                }
                appendDescription(line);
                return;
            }

            if (state == ScanState.IN_CODE_BLOCK) {
                appendDescription(line);
                return;
            }

            if (line.isBlank()) {
                // Blank lines only matter once a description has started
                if (current != null && !pendingDescription.isEmpty()) {
                    pendingDescription.add("");
                }
                return;
            }

            // Markers need trailing whitespace; a bare "***" is ordinary text
            Matcher concept = CONCEPT.matcher(raw);
            if (concept.matches()) {
                if (current == null) {
                    throw new TikiSyntaxException(HierarchyBuilder.ROOT_REQUIRED, lineNumber, raw);
                }
                finalizeDescription();
                MetadataParser.Extraction extraction = metadataParser.extract(concept.group(2));
                current = builder.create(levelOf(concept.group(1)), extraction.getTitle(), extraction.getMetadata(),
                    lineNumber, raw);
                return;
            }

            if (current == null) {
                if (line.charAt(0) == MARKER) {
                    throw new TikiSyntaxException(HierarchyBuilder.ROOT_REQUIRED, lineNumber, raw);
                }
                MetadataParser.Extraction extraction = metadataParser.extract(line.strip());
                current = builder.createRoot(extraction.getTitle(), extraction.getMetadata(), lineNumber, raw);
                return;
            }

            pendingDescription.add(line);
        }

        private void appendDescription(String line) {
            if (current != null) {
                pendingDescription.add(line);
            }
        }

        private void finalizeDescription() {
            if (current != null && !pendingDescription.isEmpty()) {
                current.setDescription(String.join("\n", pendingDescription).stripTrailing());
            }
            pendingDescription.clear();
        }

        private Map<String, Object> parseFrontmatter() {
            String yaml = String.join("\n", frontmatterLines);
            if (yaml.isBlank()) {
                return Map.of();
            }
            try {
                Map<String, Object> parsed = yamlMapper.readValue(yaml, MAP_TYPE);
                return parsed != null ? parsed : Map.of();
            } catch (JsonProcessingException e) {
                logger.warn("Ignoring unparseable frontmatter in {}: {}", describeSource(), e.getOriginalMessage());
                return Map.of();
            }
        }

        private String describeSource() {
            return name != null ? name : "<input>";
        }
    }
}
