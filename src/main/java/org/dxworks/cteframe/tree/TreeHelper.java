package org.dxworks.cteframe.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class TreeHelper {

    private TreeHelper() {
        // utility class
    }

    /**
     * Collapse all whitespace (including newlines and tabs) to single spaces and trim.
     */
    public static String normalizeInline(String s) {
        if (s == null) return null;
        return s.replaceAll("\\s+", " ").trim();
    }

    public static boolean isTypeOneOf(NodeType type, NodeType... types) {
        if (type == null) return false;
        for (NodeType t : types) if (type == t) return true;
        return false;
    }

    public static boolean isNodeTypeOneOf(SqlNode node, NodeType... types) {
        if (node == null) return false;
        return isTypeOneOf(node.getType(), types);
    }

    public static SqlNode findFirstChild(SqlNode parent, NodeType nodeType) {
        if (parent == null) return null;
        for (SqlNode child : parent.getChildren()) {
            if (child.getType() == nodeType) {
                return child;
            }
        }
        return null;
    }

    public static int indexOfFirstChild(SqlNode parent, NodeType nodeType) {
        if (parent == null) return -1;
        List<SqlNode> children = parent.getChildren();
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).getType() == nodeType) return i;
        }
        return -1;
    }

    public static int indexOfLastChild(SqlNode parent, NodeType nodeType) {
        if (parent == null) return -1;
        List<SqlNode> children = parent.getChildren();
        for (int i = children.size() - 1; i >= 0; i--) {
            if (children.get(i).getType() == nodeType) return i;
        }
        return -1;
    }

    /**
     * First following sibling of the given type, or {@code null}.
     */
    public static SqlNode findNextSibling(SqlNode node, NodeType nodeType) {
        if (node == null) return null;
        SqlNode current = node.getNextSibling();
        while (current != null && current.getType() != nodeType) {
            current = current.getNextSibling();
        }
        return current;
    }

    public static List<SqlNode> findAllDescendantsOfTypes(SqlNode root, NodeType... types) {
        List<SqlNode> result = new ArrayList<>();
        if (root == null) return result;
        Deque<SqlNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SqlNode node = stack.pop();
            if (isTypeOneOf(node.getType(), types)) result.add(node);
            List<SqlNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /**
     * Deepest descendant of {@code root} (or root itself) whose range contains {@code offset}.
     */
    public static SqlNode findDeepestNodeAt(SqlNode root, int offset) {
        if (root == null || !root.getRange().contains(offset)) return null;
        SqlNode current = root;
        boolean descended = true;
        while (descended) {
            descended = false;
            for (SqlNode child : current.getChildren()) {
                if (child.getRange().contains(offset)) {
                    current = child;
                    descended = true;
                    break;
                }
            }
        }
        return current;
    }
}
