package im.arun.tiki.parser;

import im.arun.tiki.exception.TikiSyntaxException;
import im.arun.tiki.model.ConceptNode;
import im.arun.tiki.model.MetadataValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Creates concept nodes at a requested level and assigns their structural ids.
 *
 * <p>Keeps one counter per level and a stack of the most recent node at each open level
 * (index 0 is the root). Creating a node at level L increments counter L-1, resets every
 * deeper counter, truncates the stack to L entries and attaches the node to the new top.
 * One instance serves exactly one parse.
 */
public class HierarchyBuilder {
    private static final Logger logger = LoggerFactory.getLogger(HierarchyBuilder.class);

    static final String EMPTY_TITLE = "Concept title cannot be empty";
    static final String MULTIPLE_ROOTS = "Multiple root concepts not allowed";
    static final String ROOT_REQUIRED = "File must start with an unmarked root concept";

    private final List<Integer> counters = new ArrayList<>();
    private final List<ConceptNode> stack = new ArrayList<>();
    private ConceptNode root;

    /**
     * Creates the level-0 root concept.
     */
    public ConceptNode createRoot(String title, Map<String, MetadataValue> metadata, int lineNumber, String line)
            throws TikiSyntaxException {
        return create(0, title, metadata, lineNumber, line);
    }

    /**
     * Creates a concept at {@code level} under the current ancestor at {@code level - 1}.
     *
     * @throws TikiSyntaxException on an empty title, a second root, a missing root or a skipped level
     */
    public ConceptNode create(int level, String title, Map<String, MetadataValue> metadata, int lineNumber, String line)
            throws TikiSyntaxException {
        if (title == null || title.isBlank()) {
            throw new TikiSyntaxException(EMPTY_TITLE, lineNumber, line);
        }

        if (level == 0) {
            if (root != null) {
                throw new TikiSyntaxException(MULTIPLE_ROOTS, lineNumber, line);
            }
            root = new ConceptNode("", title);
            root.putAllMetadata(metadata);
            stack.clear();
            stack.add(root);
            return root;
        }

        if (root == null) {
            throw new TikiSyntaxException(ROOT_REQUIRED, lineNumber, line);
        }

        int currentDepth = stack.size() - 1;
        if (level > currentDepth + 1) {
            throw new TikiSyntaxException(
                String.format("Invalid level jump: found level %d, expected at most %d", level, currentDepth + 1),
                lineNumber, line);
        }

        advanceCounters(level);
        String id = buildId(level);

        // Drop ancestors deeper than the new node's parent
        stack.subList(level, stack.size()).clear();
        ConceptNode parent = stack.get(stack.size() - 1);
        ConceptNode node = new ConceptNode(id, title, parent);
        node.putAllMetadata(metadata);
        stack.add(node);

        logger.debug("Created concept {} '{}' under '{}'", id, title, parent.getId());
        return node;
    }

    public ConceptNode getRoot() {
        return root;
    }

    private void advanceCounters(int level) {
        while (counters.size() < level) {
            counters.add(0);
        }
        counters.set(level - 1, counters.get(level - 1) + 1);
        for (int i = level; i < counters.size(); i++) {
            counters.set(i, 0);
        }
    }

    private String buildId(int level) {
        StringBuilder id = new StringBuilder();
        for (int i = 0; i < level; i++) {
            id.append("*".repeat(i + 1)).append(counters.get(i));
        }
        return id.toString();
    }
}
