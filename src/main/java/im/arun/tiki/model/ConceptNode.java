package im.arun.tiki.model;

import im.arun.tiki.util.TreeUtils;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single concept in a Tiki document tree.
 *
 * <p>Nodes are attached to their parent at construction time and are never moved or
 * removed afterwards. Children hold no reference to their ancestors.
 */
@Getter
public class ConceptNode {

    private final String id;

    private final String title;

    @Setter
    private String description = "";

    @Setter
    private boolean expanded = true;

    @Getter(AccessLevel.NONE)
    private final Map<String, MetadataValue> metadata = new LinkedHashMap<>();

    @Getter(AccessLevel.NONE)
    private final List<ConceptNode> children = new ArrayList<>();

    /**
     * Creates a detached node, normally the root of a document.
     */
    public ConceptNode(String id, String title) {
        this(id, title, null);
    }

    /**
     * Creates a node and appends it to {@code parent}'s children.
     *
     * @param id structural address, empty for the root
     * @param title concept title
     * @param parent the owning node, or {@code null} for a root
     */
    public ConceptNode(String id, String title, ConceptNode parent) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = Objects.requireNonNull(title, "title");
        if (parent != null) {
            parent.children.add(this);
        }
    }

    public List<ConceptNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public Map<String, MetadataValue> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void putMetadata(String key, MetadataValue value) {
        metadata.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    public void putAllMetadata(Map<String, MetadataValue> values) {
        values.forEach(this::putMetadata);
    }

    /**
     * Number of asterisk groups in the id; 0 for the root.
     */
    public int getDepth() {
        return TreeUtils.depthOf(id);
    }

    public boolean isRoot() {
        return id.isEmpty();
    }

    public boolean toggleExpanded() {
        expanded = !expanded;
        return expanded;
    }

    /**
     * Title followed by the description, separated by a blank line when a description exists.
     */
    public String getFullContent() {
        StringBuilder content = new StringBuilder(title).append('\n');
        if (!description.isBlank()) {
            content.append('\n').append(description);
        }
        return content.toString();
    }

    @Override
    public String toString() {
        return id + ": " + title;
    }
}
