package ai.bigo.analyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Utility class for common AST traversal patterns over tree-sitter nodes: recursive searches, child iteration and
 * null-safe text extraction.
 */
public final class ASTTraversalUtils {
    private ASTTraversalUtils() {}

    /** Recursively finds the first node (pre-order) matching the given predicate. */
    public static @Nullable TSNode findNodeRecursive(@Nullable TSNode rootNode, Predicate<TSNode> predicate) {
        if (isAbsent(rootNode)) {
            return null;
        }

        if (predicate.test(rootNode)) {
            return rootNode;
        }

        for (int i = 0; i < rootNode.getChildCount(); i++) {
            var result = findNodeRecursive(rootNode.getChild(i), predicate);
            if (result != null) {
                return result;
            }
        }

        return null;
    }

    /**
     * Recursively finds all nodes matching the given predicate, without descending into nodes rejected by {@code
     * descendInto}.
     */
    public static List<TSNode> findAllNodesRecursive(
            TSNode rootNode, Predicate<TSNode> predicate, Predicate<TSNode> descendInto) {
        var results = new ArrayList<TSNode>();
        findAllNodesRecursiveInternal(rootNode, predicate, descendInto, results);
        return results;
    }

    private static void findAllNodesRecursiveInternal(
            @Nullable TSNode node, Predicate<TSNode> predicate, Predicate<TSNode> descendInto, List<TSNode> results) {
        if (isAbsent(node)) {
            return;
        }

        if (predicate.test(node)) {
            results.add(node);
        }

        if (!descendInto.test(node)) {
            return;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            findAllNodesRecursiveInternal(node.getChild(i), predicate, descendInto, results);
        }
    }

    /** Named children in source order, skipping null nodes. */
    public static List<TSNode> namedChildren(@Nullable TSNode node) {
        if (isAbsent(node)) {
            return List.of();
        }
        var children = new ArrayList<TSNode>(node.getNamedChildCount());
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var child = node.getNamedChild(i);
            if (!isAbsent(child)) {
                children.add(child);
            }
        }
        return children;
    }

    /** The child bound to {@code fieldName}, or null when the field is absent. */
    public static @Nullable TSNode field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return isAbsent(child) ? null : child;
    }

    /** Extracts trimmed text from a node using the provided SourceContent. */
    public static String extractNodeText(@Nullable TSNode node, SourceContent sourceContent) {
        if (isAbsent(node)) {
            return "";
        }

        int startByte = node.getStartByte();
        int endByte = node.getEndByte();

        if (startByte < 0 || startByte > endByte) {
            return "";
        }

        return sourceContent.substringFromBytes(startByte, endByte).trim();
    }

    public static boolean isAbsent(@Nullable TSNode node) {
        return node == null || node.isNull();
    }
}
