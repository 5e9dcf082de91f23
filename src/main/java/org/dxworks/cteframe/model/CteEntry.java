package org.dxworks.cteframe.model;

import org.dxworks.cteframe.tree.SqlNode;

/**
 * One common table expression of a WITH clause.
 * {@code index} is the zero-based position among the definitions of its WITH clause.
 */
public final class CteEntry {

    private final String name;
    private final SqlNode definitionNode;
    private final int index;

    public CteEntry(String name, SqlNode definitionNode, int index) {
        this.name = name;
        this.definitionNode = definitionNode;
        this.index = index;
    }

    public String getName() {
        return name;
    }

    public SqlNode getDefinitionNode() {
        return definitionNode;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public String toString() {
        return name + "#" + index;
    }
}
