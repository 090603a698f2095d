package im.arun.tiki.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.tiki.exception.TikiExportException;
import im.arun.tiki.model.ConceptNode;
import im.arun.tiki.model.MetadataValue;
import im.arun.tiki.model.TikiDocument;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializes a document as {@code {"root": <node>, "format_version": "1.0"}}, with nodes as
 * {@code {id, title, description, expanded, metadata, children}}. Frontmatter, when present,
 * is written under {@code "frontmatter"}.
 */
public class JsonExporter {
    private final ObjectMapper objectMapper;

    public JsonExporter() {
        this(true);
    }

    public JsonExporter(boolean pretty) {
        this.objectMapper = new ObjectMapper();
        if (pretty) {
            this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
    }

    public ExportedDocument toExportedDocument(TikiDocument document) {
        Map<String, Object> frontmatter = document.getFrontmatter().isEmpty()
            ? null
            : new LinkedHashMap<>(document.getFrontmatter());
        return new ExportedDocument(toExportedNode(document.getRoot()), ExportedDocument.FORMAT_VERSION, frontmatter);
    }

    public ExportedNode toExportedNode(ConceptNode node) {
        ExportedNode exported = new ExportedNode();
        exported.setId(node.getId());
        exported.setTitle(node.getTitle());
        exported.setDescription(node.getDescription());
        exported.setExpanded(node.isExpanded());

        Map<String, Object> metadata = new LinkedHashMap<>();
        for (Map.Entry<String, MetadataValue> entry : node.getMetadata().entrySet()) {
            metadata.put(entry.getKey(), entry.getValue().toJsonValue());
        }
        exported.setMetadata(metadata);

        for (ConceptNode child : node.getChildren()) {
            exported.getChildren().add(toExportedNode(child));
        }
        return exported;
    }

    public String toJson(TikiDocument document) throws TikiExportException {
        try {
            return objectMapper.writeValueAsString(toExportedDocument(document));
        } catch (JsonProcessingException e) {
            throw new TikiExportException("Failed to serialize document to JSON", e);
        }
    }
}
