package im.arun.tiki.render;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Top-level JSON export envelope.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"root", "format_version", "frontmatter"})
public class ExportedDocument {

    public static final String FORMAT_VERSION = "1.0";

    @JsonProperty("root")
    private ExportedNode root;

    @JsonProperty("format_version")
    private String formatVersion = FORMAT_VERSION;

    @JsonProperty("frontmatter")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, Object> frontmatter;
}
