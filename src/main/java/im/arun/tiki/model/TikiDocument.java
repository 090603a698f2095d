package im.arun.tiki.model;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of parsing one Tiki source: the concept tree plus document-level frontmatter.
 */
@Getter
public class TikiDocument {

    private final String name;
    private final Map<String, Object> frontmatter;
    private final ConceptNode root;

    public TikiDocument(String name, Map<String, Object> frontmatter, ConceptNode root) {
        this.name = name;
        this.frontmatter = frontmatter == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(frontmatter));
        this.root = Objects.requireNonNull(root, "root");
    }
}
