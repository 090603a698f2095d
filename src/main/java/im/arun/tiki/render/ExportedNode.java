package im.arun.tiki.render;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of one concept.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExportedNode {

    @JsonProperty("id")
    private String id;

    @JsonProperty("title")
    private String title;

    @JsonProperty("description")
    private String description;

    @JsonProperty("expanded")
    private boolean expanded = true;

    @JsonProperty("metadata")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @JsonProperty("children")
    private List<ExportedNode> children = new ArrayList<>();
}
