package im.arun.tiki.navigator;

import im.arun.tiki.model.ConceptNode;
import im.arun.tiki.render.StyledTreeRenderer;

import java.io.PrintStream;
import java.util.List;

/**
 * {@link NavigatorView} that prints to a terminal stream using {@link StyledTreeRenderer}.
 */
public class ConsoleNavigatorView implements NavigatorView {

    private final PrintStream out;
    private final StyledTreeRenderer renderer;

    public ConsoleNavigatorView(PrintStream out, StyledTreeRenderer renderer) {
        this.out = out;
        this.renderer = renderer;
    }

    @Override
    public List<String> render(ConceptNode root, ConceptNode selected) {
        List<String> lines = renderer.renderLines(root, selected);
        lines.forEach(out::println);
        return lines;
    }

    @Override
    public void onSelect(ConceptNode node) {
        out.println("> " + (node.isRoot() ? node.getTitle() : node.getId() + " " + node.getTitle()));
    }

    @Override
    public void onSearch(SearchResult result) {
        result.first().ifPresent(first -> {
            out.printf("Found %d matches. Showing: %s%n", result.getCount(), first.getTitle());
            out.println();
            out.println(renderer.renderDetails(first));
        });
    }

    @Override
    public void onToggleExpand(ConceptNode node, boolean expanded) {
        out.println((expanded ? "Expanded " : "Collapsed ") + node.getId() + " " + node.getTitle());
    }

    @Override
    public void onMessage(String message) {
        out.println(message);
    }
}
