package org.dxworks.cteframe.tree;

/**
 * A parsed SQL document.
 */
public interface SqlTree {

    SqlNode getRoot();

    String getSource();

    /**
     * Returns the deepest node whose range contains {@code offset}, or {@code null}
     * when the offset lies outside the document. An offset equal to the document
     * length resolves to the last character before any trailing whitespace and
     * statement terminators.
     */
    SqlNode findNodeAt(int offset);
}
