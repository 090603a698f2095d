package im.arun.tiki.render;

import im.arun.tiki.model.ConceptNode;
import im.arun.tiki.model.MetadataValue;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Help.Ansi.IStyle;
import picocli.CommandLine.Help.Ansi.Style;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Terminal tree with ANSI styling. Root, current selection, expanded and collapsed concepts
 * are each drawn in their own style; with {@link Ansi#OFF} the output matches
 * {@link AsciiTreeRenderer} apart from the optional heading.
 */
public class StyledTreeRenderer {

    static final String NO_DESCRIPTION = "No description provided";

    private static final IStyle[] ROOT = {Style.bold, Style.fg_cyan};
    private static final IStyle[] CONCEPT = {Style.fg_white};
    private static final IStyle[] CURRENT = {Style.fg_black, Style.bg_yellow};
    private static final IStyle[] COLLAPSED = {Style.faint, Style.fg_cyan};
    private static final IStyle[] GUIDE = {Style.fg_blue};
    private static final IStyle[] HEADING = {Style.bold};
    private static final IStyle[] DIM = {Style.faint};

    private final Ansi ansi;
    private final AsciiTreeRenderer labels;

    public StyledTreeRenderer(Ansi ansi, String collapseMarker) {
        this.ansi = ansi;
        this.labels = new AsciiTreeRenderer(collapseMarker);
    }

    public String render(ConceptNode root, ConceptNode current, String heading) {
        List<String> lines = new ArrayList<>();
        if (heading != null) {
            lines.add("");
            lines.add(style(heading, HEADING));
        }
        lines.addAll(renderLines(root, current));
        return String.join("\n", lines);
    }

    public List<String> renderLines(ConceptNode root, ConceptNode current) {
        List<String> lines = new ArrayList<>();
        lines.add(style(root.getTitle(), root == current ? CURRENT : ROOT));
        appendChildren(root, current, "", lines);
        return lines;
    }

    private void appendChildren(ConceptNode node, ConceptNode current, String prefix, List<String> lines) {
        List<ConceptNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            ConceptNode child = children.get(i);
            boolean last = i == children.size() - 1;

            IStyle[] labelStyle;
            if (child == current) {
                labelStyle = CURRENT;
            } else if (child.isExpanded()) {
                labelStyle = CONCEPT;
            } else {
                labelStyle = COLLAPSED;
            }

            String connector = last ? AsciiTreeRenderer.LAST_BRANCH : AsciiTreeRenderer.BRANCH;
            lines.add(style(prefix + connector, GUIDE) + style(labels.label(child), labelStyle));

            if (child.isExpanded() && child.hasChildren()) {
                String guide = last ? AsciiTreeRenderer.SPACE : AsciiTreeRenderer.PIPE;
                appendChildren(child, current, prefix + guide, lines);
            }
        }
    }

    /**
     * Detail view of one concept: header, metadata entries, then the description or a placeholder.
     */
    public String renderDetails(ConceptNode node) {
        StringBuilder details = new StringBuilder();
        if (node.isRoot()) {
            details.append(style(node.getTitle(), HEADING));
        } else {
            details.append(style(node.getId(), ROOT)).append(": ").append(style(node.getTitle(), HEADING));
        }
        details.append('\n');

        for (Map.Entry<String, MetadataValue> entry : node.getMetadata().entrySet()) {
            details.append(style("  " + entry.getKey() + ": " + entry.getValue(), DIM)).append('\n');
        }

        if (node.getDescription().isBlank()) {
            details.append('\n').append(style(NO_DESCRIPTION, DIM));
        } else {
            details.append('\n').append(node.getDescription());
        }
        return details.toString();
    }

    private String style(String text, IStyle[] styles) {
        if (!ansi.enabled() || text.isEmpty()) {
            return text;
        }
        StringBuilder styled = new StringBuilder();
        for (IStyle s : styles) {
            styled.append(s.on());
        }
        return styled.append(text).append(Style.reset.on()).toString();
    }
}
