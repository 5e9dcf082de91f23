package org.dxworks.cteframe.tree;

import org.dxworks.cteframe.model.SourceRange;

import java.util.List;

/**
 * Read-only view of a node in a parsed SQL document.
 * Implementations must never change once handed to the analyzer.
 */
public interface SqlNode {

    NodeType getType();

    /**
     * Literal source text covered by {@link #getRange()}, hidden tokens included.
     */
    String getText();

    List<SqlNode> getChildren();

    SqlNode getParent();

    SqlNode getPrevSibling();

    SqlNode getNextSibling();

    SourceRange getRange();

    default SqlNode getFirstChild() {
        List<SqlNode> children = getChildren();
        return children.isEmpty() ? null : children.get(0);
    }
}
