package im.arun.tiki.util;

import im.arun.tiki.model.ConceptNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Traversal helpers over {@link ConceptNode} trees. All traversals are depth-first pre-order
 * in document order.
 */
public final class TreeUtils {

    private TreeUtils() {}

    /**
     * Every node of the tree, root first.
     */
    public static List<ConceptNode> preOrder(ConceptNode root) {
        List<ConceptNode> result = new ArrayList<>();
        Deque<ConceptNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            ConceptNode node = stack.pop();
            result.add(node);
            List<ConceptNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /**
     * Nodes reachable without entering a collapsed subtree. The root is always included.
     */
    public static List<ConceptNode> visibleNodes(ConceptNode root) {
        List<ConceptNode> result = new ArrayList<>();
        collectVisible(root, result);
        return result;
    }

    private static void collectVisible(ConceptNode node, List<ConceptNode> out) {
        out.add(node);
        if (node.isRoot() || node.isExpanded()) {
            for (ConceptNode child : node.getChildren()) {
                collectVisible(child, out);
            }
        }
    }

    /**
     * Total number of concepts, root included.
     */
    public static int countConcepts(ConceptNode root) {
        return preOrder(root).size();
    }

    public static int maxDepth(ConceptNode root) {
        int max = 0;
        for (ConceptNode node : preOrder(root)) {
            max = Math.max(max, node.getDepth());
        }
        return max;
    }

    public static Optional<ConceptNode> findById(ConceptNode root, String id) {
        if (id == null) {
            return Optional.empty();
        }
        return preOrder(root).stream()
            .filter(node -> node.getId().equals(id))
            .findFirst();
    }

    /**
     * Path from root to {@code target}, both inclusive. Empty if the target is not in the tree.
     */
    public static List<ConceptNode> pathTo(ConceptNode root, ConceptNode target) {
        List<ConceptNode> path = new ArrayList<>();
        if (!collectPath(root, target, path)) {
            path.clear();
        }
        return path;
    }

    private static boolean collectPath(ConceptNode node, ConceptNode target, List<ConceptNode> path) {
        path.add(node);
        if (node == target) {
            return true;
        }
        for (ConceptNode child : node.getChildren()) {
            if (collectPath(child, target, path)) {
                return true;
            }
        }
        path.remove(path.size() - 1);
        return false;
    }

    /**
     * Number of asterisk groups in a structural id, e.g. {@code *1**2***1} is 3.
     */
    public static int depthOf(String id) {
        if (id == null || id.isEmpty()) {
            return 0;
        }
        int groups = 0;
        boolean inRun = false;
        for (int i = 0; i < id.length(); i++) {
            boolean marker = id.charAt(i) == '*';
            if (marker && !inRun) {
                groups++;
            }
            inRun = marker;
        }
        return groups;
    }
}
