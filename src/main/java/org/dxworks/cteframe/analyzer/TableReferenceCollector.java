package org.dxworks.cteframe.analyzer;

import org.dxworks.cteframe.tree.NodeType;
import org.dxworks.cteframe.tree.SqlNode;
import org.dxworks.cteframe.tree.TreeHelper;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the names a query mentions in FROM and JOIN positions.
 * This is a syntactic scan: aliases and other identifiers inside those constructs are collected too.
 */
public final class TableReferenceCollector {

    private static final NodeType[] REFERENCE_CONTAINERS = {
            NodeType.FROM_CLAUSE, NodeType.TABLE_REFERENCE, NodeType.JOIN_EXPRESSION
    };

    private TableReferenceCollector() {
        // utility class
    }

    /**
     * Identifier texts found below any FROM clause, table reference or join inside {@code root}
     * (root included), in first-seen order.
     */
    public static Set<String> collect(SqlNode root) {
        Set<String> references = new LinkedHashSet<>();
        if (root == null) return references;
        for (SqlNode container : TreeHelper.findAllDescendantsOfTypes(root, REFERENCE_CONTAINERS)) {
            for (SqlNode identifier : TreeHelper.findAllDescendantsOfTypes(container, NodeType.IDENTIFIER)) {
                addReference(references, identifier.getText());
            }
        }
        return references;
    }

    private static void addReference(Set<String> references, String name) {
        if (name != null && !name.isEmpty()) {
            references.add(name);
        }
    }
}
