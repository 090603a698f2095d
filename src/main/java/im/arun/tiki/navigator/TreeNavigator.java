package im.arun.tiki.navigator;

import im.arun.tiki.model.ConceptNode;
import im.arun.tiki.render.StyledTreeRenderer;
import im.arun.tiki.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Selection, expand/collapse and search over a parsed tree.
 *
 * <p>The only change this class makes to the tree is the per-node {@code expanded} flag.
 */
public class TreeNavigator {
    private static final Logger logger = LoggerFactory.getLogger(TreeNavigator.class);

    private final ConceptNode root;
    private final NavigatorView view;
    private final StyledTreeRenderer detailsRenderer;
    private ConceptNode selected;

    public TreeNavigator(ConceptNode root, NavigatorView view, StyledTreeRenderer detailsRenderer) {
        this.root = root;
        this.view = view;
        this.detailsRenderer = detailsRenderer;
        this.selected = root;
    }

    public ConceptNode getRoot() {
        return root;
    }

    public ConceptNode getSelected() {
        return selected;
    }

    /**
     * Nodes currently shown, in pre-order. Descendants of collapsed nodes are hidden.
     */
    public List<ConceptNode> visibleNodes() {
        return TreeUtils.visibleNodes(root);
    }

    public List<String> refresh() {
        return view.render(root, selected);
    }

    public ConceptNode moveDown() {
        return moveBy(1);
    }

    public ConceptNode moveUp() {
        return moveBy(-1);
    }

    public ConceptNode selectFirst() {
        return select(root);
    }

    public ConceptNode selectLast() {
        List<ConceptNode> visible = visibleNodes();
        return select(visible.get(visible.size() - 1));
    }

    private ConceptNode moveBy(int delta) {
        List<ConceptNode> visible = visibleNodes();
        int index = visible.indexOf(selected);
        int target = Math.max(0, Math.min(visible.size() - 1, index + delta));
        return select(visible.get(target));
    }

    /**
     * Makes {@code node} the selection, expanding collapsed ancestors so it is visible.
     */
    public ConceptNode select(ConceptNode node) {
        List<ConceptNode> path = TreeUtils.pathTo(root, node);
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Node is not part of this tree: " + node);
        }
        for (ConceptNode ancestor : path.subList(0, path.size() - 1)) {
            if (!ancestor.isExpanded()) {
                ancestor.setExpanded(true);
                view.onToggleExpand(ancestor, true);
            }
        }
        selected = node;
        view.onSelect(node);
        return node;
    }

    /**
     * Flips the expanded flag of the selection. The root and nodes without children are left alone.
     */
    public boolean toggleExpand() {
        if (selected.isRoot()) {
            view.onMessage("The root concept is always expanded");
            return true;
        }
        if (!selected.hasChildren()) {
            view.onMessage("Nothing to expand: " + describe(selected));
            return selected.isExpanded();
        }
        boolean expanded = selected.toggleExpanded();
        view.onToggleExpand(selected, expanded);
        return expanded;
    }

    /**
     * Case-insensitive substring search over titles and ids of the whole tree, including
     * collapsed parts. The first match becomes the selection.
     */
    public SearchResult search(String query) {
        String needle = query == null ? "" : query.strip().toLowerCase(Locale.ROOT);
        if (needle.isEmpty()) {
            view.onMessage("Empty search query");
            return new SearchResult("", List.of());
        }

        List<ConceptNode> matches = TreeUtils.preOrder(root).stream()
            .filter(node -> node.getTitle().toLowerCase(Locale.ROOT).contains(needle)
                || node.getId().toLowerCase(Locale.ROOT).contains(needle))
            .collect(Collectors.toList());
        SearchResult result = new SearchResult(query.strip(), List.copyOf(matches));
        logger.debug("Search '{}' matched {} concepts", needle, result.getCount());

        if (result.isEmpty()) {
            view.onMessage("No matches found for: '" + result.getQuery() + "'");
        } else {
            select(result.getMatches().get(0));
        }
        view.onSearch(result);
        return result;
    }

    /**
     * Selects the concept with exactly this id; the empty id is the root.
     */
    public Optional<ConceptNode> jumpToId(String id) {
        String target = id == null ? "" : id.strip();
        Optional<ConceptNode> found = TreeUtils.findById(root, target);
        if (found.isPresent()) {
            select(found.get());
        } else {
            view.onMessage("No concept with id: " + target);
        }
        return found;
    }

    /**
     * Detail text of the selection: title and description, or a placeholder when empty.
     */
    public String details() {
        return detailsRenderer.renderDetails(selected);
    }

    private static String describe(ConceptNode node) {
        return node.isRoot() ? node.getTitle() : node.getId() + " " + node.getTitle();
    }
}
