package im.arun.tiki.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.tiki.exception.TikiException;
import im.arun.tiki.model.ConceptNode;
import im.arun.tiki.model.MetadataValue;
import im.arun.tiki.model.TikiDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Rebuilds a {@link TikiDocument} from JSON produced by {@link JsonExporter}.
 */
public class JsonImporter {
    private static final Logger logger = LoggerFactory.getLogger(JsonImporter.class);
    private final ObjectMapper objectMapper;

    public JsonImporter() {
        this.objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public TikiDocument fromJson(String json, String name) throws TikiException {
        ExportedDocument exported;
        try {
            exported = objectMapper.readValue(json, ExportedDocument.class);
        } catch (JsonProcessingException e) {
            throw new TikiException("Invalid Tiki JSON: " + e.getOriginalMessage(), e);
        }

        if (exported == null || exported.getRoot() == null) {
            throw new TikiException("Invalid Tiki JSON: missing root");
        }
        if (!ExportedDocument.FORMAT_VERSION.equals(exported.getFormatVersion())) {
            throw new TikiException("Unsupported format_version: " + exported.getFormatVersion());
        }

        ConceptNode root = toConcept(exported.getRoot(), null);
        logger.debug("Imported document '{}' from JSON", root.getTitle());
        return new TikiDocument(name, exported.getFrontmatter(), root);
    }

    private ConceptNode toConcept(ExportedNode exported, ConceptNode parent) throws TikiException {
        if (exported.getId() == null || exported.getTitle() == null) {
            throw new TikiException("Invalid Tiki JSON: node without id or title");
        }

        ConceptNode node = new ConceptNode(exported.getId(), exported.getTitle(), parent);
        node.setDescription(exported.getDescription() != null ? exported.getDescription() : "");
        node.setExpanded(exported.isExpanded());

        if (exported.getMetadata() != null) {
            for (Map.Entry<String, Object> entry : exported.getMetadata().entrySet()) {
                try {
                    node.putMetadata(entry.getKey(), MetadataValue.fromJson(entry.getValue()));
                } catch (IllegalArgumentException e) {
                    throw new TikiException("Invalid metadata '" + entry.getKey() + "' on " + exported.getId(), e);
                }
            }
        }

        if (exported.getChildren() != null) {
            for (ExportedNode child : exported.getChildren()) {
                toConcept(child, node);
            }
        }
        return node;
    }
}
