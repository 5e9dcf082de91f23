package org.dxworks.cteframe.builder;

import org.dxworks.cteframe.model.SourceRange;
import org.dxworks.cteframe.tree.NodeType;
import org.dxworks.cteframe.tree.SqlNode;
import org.dxworks.cteframe.tree.TreeHelper;

import java.util.List;

/**
 * Structural lookups on a CTE definition shared by every {@link HighlightMode}.
 * Missing structure yields {@code null}; callers pick their own fallback.
 */
public final class CteStructure {

    private CteStructure() {
        // utility class
    }

    /**
     * Defining identifier text, or an empty string for a definition without children.
     */
    public static String name(SqlNode cteDefinition) {
        SqlNode first = cteDefinition.getFirstChild();
        return first != null ? first.getText() : "";
    }

    /**
     * Text between the first {@code (} and the last {@code )} among the definition's direct children.
     */
    public static String innerBodyText(SqlNode cteDefinition) {
        List<SqlNode> inner = innerBodyChildren(cteDefinition);
        if (inner == null) return null;
        StringBuilder sb = new StringBuilder();
        for (SqlNode node : inner) {
            sb.append(node.getText());
        }
        return sb.toString();
    }

    /**
     * Source range covering the inner body children, see {@link #innerBodyText(SqlNode)}.
     */
    public static SourceRange innerBodyRange(SqlNode cteDefinition) {
        List<SqlNode> inner = innerBodyChildren(cteDefinition);
        if (inner == null) return null;
        SourceRange range = inner.get(0).getRange();
        for (SqlNode node : inner) {
            range = range.union(node.getRange());
        }
        return range;
    }

    private static List<SqlNode> innerBodyChildren(SqlNode cteDefinition) {
        int open = TreeHelper.indexOfFirstChild(cteDefinition, NodeType.LEFT_PAREN);
        int close = TreeHelper.indexOfLastChild(cteDefinition, NodeType.RIGHT_PAREN);
        if (open < 0 || close < 0 || open + 1 >= close) return null;
        return cteDefinition.getChildren().subList(open + 1, close);
    }

    /**
     * The comma following the definition among its siblings.
     */
    public static SqlNode findSeparatorComma(SqlNode cteDefinition) {
        return TreeHelper.findNextSibling(cteDefinition, NodeType.COMMA);
    }

    /**
     * The WITH keyword of the clause defining this CTE.
     */
    public static SqlNode findWithKeyword(SqlNode cteDefinition) {
        return TreeHelper.findFirstChild(cteDefinition.getParent(), NodeType.WITH_KEYWORD);
    }
}
