package org.dxworks.cteframe.model;

import org.dxworks.cteframe.tree.SqlNode;

import java.util.List;

/**
 * Result of analysing one cursor position: the CTEs of the enclosing WITH clause,
 * the subset the target query needs, and the target query itself.
 */
public final class ScopeAnalysis {

    private final List<CteEntry> allCtes;
    private final List<CteEntry> requiredCtes;
    private final SqlNode targetQuery;
    private final SqlNode scopeNode;

    public ScopeAnalysis(List<CteEntry> allCtes, List<CteEntry> requiredCtes,
                         SqlNode targetQuery, SqlNode scopeNode) {
        this.allCtes = List.copyOf(allCtes);
        this.requiredCtes = List.copyOf(requiredCtes);
        this.targetQuery = targetQuery;
        this.scopeNode = scopeNode;
    }

    public List<CteEntry> getAllCtes() {
        return allCtes;
    }

    public List<CteEntry> getRequiredCtes() {
        return requiredCtes;
    }

    public SqlNode getTargetQuery() {
        return targetQuery;
    }

    public SqlNode getScopeNode() {
        return scopeNode;
    }

    /**
     * The entry whose definition node is the target query, or {@code null} when the target is not a CTE.
     */
    public CteEntry getTargetCte() {
        for (CteEntry cte : allCtes) {
            if (cte.getDefinitionNode() == targetQuery) return cte;
        }
        return null;
    }
}
