package org.dxworks.cteframe.analyzer;

import org.dxworks.cteframe.model.AnalysisOutcome;
import org.dxworks.cteframe.model.CteEntry;
import org.dxworks.cteframe.model.ScopeAnalysis;
import org.dxworks.cteframe.tree.NodeType;
import org.dxworks.cteframe.tree.SqlNode;
import org.dxworks.cteframe.tree.SqlTree;
import org.dxworks.cteframe.tree.TreeHelper;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finds the WITH clause around a cursor position, the query the cursor points at,
 * and every CTE that query needs directly or transitively.
 *
 * <p>Only inspects the tree; SQL text and highlight spans are produced by
 * {@link org.dxworks.cteframe.builder.SqlBuilder}.
 */
public class SqlDependencyAnalyzer {

    private static final NodeType[] TARGET_TYPES = {
            NodeType.SELECT_STATEMENT, NodeType.QUERY_EXPRESSION, NodeType.NAMED_QUERY_DEFINITION
    };

    private final SqlTree tree;
    private final int caretOffset;

    public SqlDependencyAnalyzer(SqlTree tree, int caretOffset) {
        this.tree = tree;
        this.caretOffset = caretOffset;
    }

    public AnalysisOutcome analyze() {
        SqlNode nodeAtCaret = tree.findNodeAt(caretOffset);
        if (nodeAtCaret == null) return AnalysisOutcome.noScope();

        SqlNode scope = findEnclosingScope(nodeAtCaret);
        if (scope == null) return AnalysisOutcome.noScope();

        List<CteEntry> allCtes = extractAllCtes(scope);
        if (allCtes.isEmpty()) return AnalysisOutcome.noCtes();

        // Innermost query, not the outermost statement
        SqlNode targetQuery = findTargetQuery(nodeAtCaret, scope);

        Set<String> available = allCtes.stream().map(CteEntry::getName).collect(Collectors.toSet());
        Set<String> requiredNames = resolveDependencies(targetQuery, scope, available);

        List<CteEntry> requiredCtes = allCtes.stream()
                .filter(cte -> requiredNames.contains(cte.getName()))
                .collect(Collectors.toList());

        return AnalysisOutcome.analyzed(new ScopeAnalysis(allCtes, requiredCtes, targetQuery, scope));
    }

    /**
     * Nearest WITH clause at or above {@code node}. A WITH query wrapper contributes its own WITH clause,
     * so the main statement after the CTE list is in scope too.
     */
    static SqlNode findEnclosingScope(SqlNode node) {
        SqlNode current = node;
        while (current != null) {
            switch (current.getType()) {
                case WITH_CLAUSE:
                    return current;
                case WITH_QUERY_WRAPPER:
                    return TreeHelper.findFirstChild(current, NodeType.WITH_CLAUSE);
                default:
                    break;
            }
            current = current.getParent();
        }
        return null;
    }

    static List<CteEntry> extractAllCtes(SqlNode scope) {
        List<CteEntry> ctes = new ArrayList<>();
        int index = 0;
        for (SqlNode child : scope.getChildren()) {
            if (child.getType() != NodeType.NAMED_QUERY_DEFINITION) continue;
            SqlNode nameNode = child.getFirstChild();
            if (nameNode == null) continue;
            ctes.add(new CteEntry(nameNode.getText(), child, index++));
        }
        return ctes;
    }

    /**
     * Innermost select, subquery or CTE definition containing {@code nodeAtCaret}, without leaving
     * the scope. Falls back to the statement following the WITH clause.
     */
    static SqlNode findTargetQuery(SqlNode nodeAtCaret, SqlNode scope) {
        SqlNode boundary = scope.getParent();
        SqlNode current = nodeAtCaret;
        while (current != null && current != scope && current != boundary) {
            if (TreeHelper.isNodeTypeOneOf(current, TARGET_TYPES)) {
                return current;
            }
            current = current.getParent();
        }

        SqlNode mainQuery = findMainQueryAfterWith(scope);
        if (mainQuery != null) return mainQuery;
        return boundary != null ? boundary : scope;
    }

    private static SqlNode findMainQueryAfterWith(SqlNode scope) {
        SqlNode following = TreeHelper.findNextSibling(scope, NodeType.SELECT_STATEMENT);
        if (following != null) return following;

        SqlNode parent = scope.getParent();
        if (parent == null) return null;
        for (SqlNode child : parent.getChildren()) {
            if (child != scope && child.getType() == NodeType.SELECT_STATEMENT) {
                return child;
            }
        }
        return null;
    }

    /**
     * Names from {@code availableNames} that {@code node} needs, directly or through other CTEs of {@code scope}.
     * Each call starts with a fresh visited set, so repeated calls give the same answer.
     */
    public static Set<String> resolveDependencies(SqlNode node, SqlNode scope, Set<String> availableNames) {
        return resolve(node, scope, availableNames, new HashSet<>());
    }

    // visited is shared by the whole call tree: a name is expanded at most once, which also ends cycles
    private static Set<String> resolve(SqlNode node, SqlNode scope, Set<String> availableNames, Set<String> visited) {
        Set<String> dependencies = new LinkedHashSet<>();
        for (String reference : TableReferenceCollector.collect(node)) {
            if (!availableNames.contains(reference) || !visited.add(reference)) continue;
            dependencies.add(reference);

            SqlNode definition = findCteByName(scope, reference);
            if (definition != null) {
                dependencies.addAll(resolve(definition, scope, availableNames, visited));
            }
        }
        return dependencies;
    }

    /**
     * First CTE definition of {@code scope} with the given name.
     */
    static SqlNode findCteByName(SqlNode scope, String name) {
        for (SqlNode child : scope.getChildren()) {
            if (child.getType() != NodeType.NAMED_QUERY_DEFINITION) continue;
            SqlNode nameNode = child.getFirstChild();
            if (nameNode != null && name.equals(nameNode.getText())) {
                return child;
            }
        }
        return null;
    }
}
