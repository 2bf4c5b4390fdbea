package im.arun.booklink.util;

import im.arun.booklink.model.Node;
import im.arun.booklink.model.NodeKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Utility methods for walking and querying document trees.
 */
public final class TreeUtils {

    private TreeUtils() {}

    /**
     * All nodes of the subtree in document order, root included.
     */
    public static List<Node> preorder(Node root) {
        List<Node> result = new ArrayList<>();
        collect(root, result);
        return result;
    }

    private static void collect(Node node, List<Node> result) {
        result.add(node);
        for (Node child : node.getChildren()) {
            collect(child, result);
        }
    }

    public static List<Node> findAll(Node root, NodeKind kind) {
        List<Node> result = new ArrayList<>();
        for (Node node : preorder(root)) {
            if (node.getKind() == kind) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * Every identifier declared anywhere in the tree, including the pending
     * {@code refid} of anchor targets that have not been adopted yet.
     */
    public static Set<String> declaredIds(Node root) {
        Set<String> ids = new LinkedHashSet<>();
        for (Node node : preorder(root)) {
            ids.addAll(node.getIds());
            if (node.getKind() == NodeKind.TARGET && node.getAttribute(Node.REFID) != null) {
                ids.add(node.getAttribute(Node.REFID));
            }
        }
        return ids;
    }

    /**
     * Label of the nearest enclosing numbered section, or null.
     */
    public static String enclosingSectionLabel(Node node) {
        Node section = node.findAncestor(NodeKind.SECTION);
        while (section != null) {
            String label = section.getAttribute(Node.LABEL);
            if (label != null) {
                return label;
            }
            section = section.findAncestor(NodeKind.SECTION);
        }
        return null;
    }
}
