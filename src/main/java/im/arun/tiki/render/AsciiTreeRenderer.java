package im.arun.tiki.render;

import im.arun.tiki.model.ConceptNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text tree using box-drawing connectors.
 *
 * <pre>
 * Root
 * ├── *1 First
 * │   └── *1**1 Nested
 * └── *2 Second [+]
 * </pre>
 *
 * A node with children that is collapsed gets the collapse marker and its subtree is omitted.
 */
public class AsciiTreeRenderer {

    static final String BRANCH = "├── ";
    static final String LAST_BRANCH = "└── ";
    static final String PIPE = "│   ";
    static final String SPACE = "    ";

    private final String collapseMarker;

    public AsciiTreeRenderer() {
        this("[+]");
    }

    public AsciiTreeRenderer(String collapseMarker) {
        this.collapseMarker = collapseMarker;
    }

    public String render(ConceptNode root) {
        return String.join("\n", renderLines(root));
    }

    public List<String> renderLines(ConceptNode root) {
        List<String> lines = new ArrayList<>();
        lines.add(root.getTitle());
        appendChildren(root, "", lines);
        return lines;
    }

    private void appendChildren(ConceptNode node, String prefix, List<String> lines) {
        List<ConceptNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            ConceptNode child = children.get(i);
            boolean last = i == children.size() - 1;

            lines.add(prefix + (last ? LAST_BRANCH : BRANCH) + label(child));

            if (child.isExpanded() && child.hasChildren()) {
                appendChildren(child, prefix + (last ? SPACE : PIPE), lines);
            }
        }
    }

    String label(ConceptNode node) {
        String label = node.getId() + " " + node.getTitle();
        if (node.hasChildren() && !node.isExpanded()) {
            label += " " + collapseMarker;
        }
        return label;
    }
}
