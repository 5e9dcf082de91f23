package org.dxworks.cteframe.options;

import org.dxworks.cteframe.builder.CteStructure;
import org.dxworks.cteframe.builder.HighlightMode;
import org.dxworks.cteframe.builder.SqlBuilder;
import org.dxworks.cteframe.model.BuildResult;
import org.dxworks.cteframe.model.CteEntry;
import org.dxworks.cteframe.model.QueryOption;
import org.dxworks.cteframe.model.QueryOptionList;
import org.dxworks.cteframe.model.ScopeAnalysis;
import org.dxworks.cteframe.tree.NodeType;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link ScopeAnalysis} into the list of queries a user can pick from.
 */
public final class QueryOptionPlanner {

    private QueryOptionPlanner() {
        // utility class
    }

    /**
     * One option per CTE of the scope. Option {@code i} runs CTEs {@code 0..i} and selects from CTE {@code i}.
     * The CTE containing the caret is preselected, otherwise the last one.
     */
    public static QueryOptionList progressiveOptions(ScopeAnalysis analysis, int caretOffset) {
        List<CteEntry> allCtes = analysis.getAllCtes();
        List<QueryOption> options = new ArrayList<>();
        int preselected = allCtes.size() - 1;

        for (CteEntry cte : allCtes) {
            List<CteEntry> ctesUpToThis = allCtes.subList(0, cte.getIndex() + 1);
            BuildResult result = SqlBuilder.build(
                    ctesUpToThis, cte.getDefinitionNode(), allCtes, HighlightMode.PROGRESSIVE_CTE);
            options.add(QueryOption.of(cte.getName(), result));

            if (cte.getDefinitionNode().getRange().contains(caretOffset)) {
                preselected = cte.getIndex();
            }
        }
        return new QueryOptionList(options, preselected);
    }

    /**
     * One option per required CTE (together with the required CTEs before it), followed by the query at the
     * caret with all of its dependencies. The last option is preselected.
     */
    public static QueryOptionList executeFromHereOptions(ScopeAnalysis analysis) {
        List<CteEntry> required = analysis.getRequiredCtes();
        List<QueryOption> options = new ArrayList<>();

        for (int i = 0; i < required.size(); i++) {
            CteEntry cte = required.get(i);
            List<CteEntry> ctesUpToHere = required.subList(0, i + 1);
            BuildResult result = SqlBuilder.build(
                    ctesUpToHere, cte.getDefinitionNode(), analysis.getAllCtes(),
                    HighlightMode.DEPENDENCIES_WITH_TARGET_INNER);
            options.add(QueryOption.of(dependencyDisplayName(cte, i), result));
        }

        BuildResult full = SqlBuilder.build(
                required, analysis.getTargetQuery(), analysis.getAllCtes(), HighlightMode.FULL_CTE);
        options.add(QueryOption.of(currentQueryDisplayName(analysis), full));

        return new QueryOptionList(options, options.size() - 1);
    }

    static String dependencyDisplayName(CteEntry cte, int dependencyCount) {
        if (dependencyCount <= 0) return cte.getName();
        return cte.getName() + " (+ " + pluralCtes(dependencyCount) + ")";
    }

    static String currentQueryDisplayName(ScopeAnalysis analysis) {
        String name;
        if (analysis.getTargetQuery().getType() == NodeType.NAMED_QUERY_DEFINITION) {
            String cteName = CteStructure.name(analysis.getTargetQuery());
            name = cteName.isEmpty() ? "Current CTE" : cteName;
        } else {
            name = "Current Query";
        }
        return name + " (" + pluralCtes(analysis.getRequiredCtes().size()) + ")";
    }

    private static String pluralCtes(int count) {
        return count + (count == 1 ? " CTE" : " CTEs");
    }
}
