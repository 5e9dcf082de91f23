package org.dxworks.cteframe.builder;

import org.dxworks.cteframe.model.BuildResult;
import org.dxworks.cteframe.model.CteEntry;
import org.dxworks.cteframe.model.SourceRange;
import org.dxworks.cteframe.tree.NodeType;
import org.dxworks.cteframe.tree.SqlNode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds standalone SQL and the matching highlight spans from analysed CTEs.
 *
 * <p>The SQL is a fresh composition ({@code WITH} is always written out), while the spans mirror the
 * original document, so a missing WITH keyword or comma only affects the spans.
 * The caller decides which CTEs to pass: a CTE target is not added to {@code ctes} implicitly.
 */
public final class SqlBuilder {

    private SqlBuilder() {
        // utility class
    }

    public static BuildResult build(List<CteEntry> ctes, SqlNode targetQuery) {
        return build(ctes, targetQuery, ctes, HighlightMode.FULL_CTE);
    }

    /**
     * @param ctes        CTEs to include, in document order
     * @param targetQuery query the SQL ends with
     * @param allCtes     every CTE of the scope, for context
     * @param mode        assembly and highlight policy
     */
    public static BuildResult build(List<CteEntry> ctes, SqlNode targetQuery,
                                    List<CteEntry> allCtes, HighlightMode mode) {
        String sql = buildSql(ctes, targetQuery, mode);
        List<SourceRange> spans = buildHighlightRanges(ctes, targetQuery, allCtes, mode);
        return new BuildResult(sql, spans);
    }

    // ---- SQL text ----

    static String buildSql(List<CteEntry> ctes, SqlNode targetQuery, HighlightMode mode) {
        List<String> parts = new ArrayList<>();

        if (mode == HighlightMode.DEPENDENCIES_WITH_TARGET_INNER && !ctes.isEmpty()) {
            // Everything but the last CTE stays in the WITH clause, the last one's body becomes the statement
            List<CteEntry> dependencies = ctes.subList(0, ctes.size() - 1);
            CteEntry target = ctes.get(ctes.size() - 1);

            if (!dependencies.isEmpty()) {
                parts.add(withClause(dependencies));
            }
            String innerSelect = CteStructure.innerBodyText(target.getDefinitionNode());
            parts.add(innerSelect != null ? innerSelect : selectAllFrom(target.getName()));
        } else {
            if (!ctes.isEmpty()) {
                parts.add(withClause(ctes));
            }
            parts.add(queryText(targetQuery));
        }

        return terminate(String.join("\n", parts));
    }

    private static String withClause(List<CteEntry> ctes) {
        return "WITH " + ctes.stream()
                .map(cte -> cte.getDefinitionNode().getText())
                .collect(Collectors.joining(",\n"));
    }

    private static String queryText(SqlNode targetQuery) {
        if (targetQuery.getType() == NodeType.NAMED_QUERY_DEFINITION) {
            return selectAllFrom(CteStructure.name(targetQuery));
        }
        return targetQuery.getText();
    }

    private static String selectAllFrom(String name) {
        return "SELECT * FROM " + name;
    }

    static String terminate(String sql) {
        return sql.trim().endsWith(";") ? sql : sql + ";";
    }

    // ---- Highlight spans ----

    static List<SourceRange> buildHighlightRanges(List<CteEntry> ctes, SqlNode targetQuery,
                                                  List<CteEntry> allCtes, HighlightMode mode) {
        if (ctes.isEmpty()) {
            return List.of(targetQuery.getRange());
        }

        switch (mode) {
            case PROGRESSIVE_CTE:
                return buildProgressiveCteRanges(ctes, targetQuery);
            case SINGLE_CTE_INNER:
                return buildSingleCteInnerRanges(ctes);
            case DEPENDENCIES_WITH_TARGET_INNER:
                return buildDependenciesWithTargetInnerRanges(ctes);
            case FULL_CTE:
            default:
                return buildFullCteRanges(ctes, targetQuery);
        }
    }

    private static List<SourceRange> buildFullCteRanges(List<CteEntry> ctes, SqlNode targetQuery) {
        List<SourceRange> ranges = new ArrayList<>();
        addCteChain(ctes, ranges);
        ranges.add(targetQuery.getRange());
        return ranges;
    }

    /**
     * Every CTE before the selected one in full with its comma, the selected one as its inner query only.
     * The selected CTE is the target when the target is one of {@code ctes}, otherwise the highest index.
     */
    private static List<SourceRange> buildProgressiveCteRanges(List<CteEntry> ctes, SqlNode targetQuery) {
        List<SourceRange> ranges = new ArrayList<>();
        int maxIndex = selectedIndex(ctes, targetQuery);

        for (int i = 0; i < ctes.size(); i++) {
            CteEntry cte = ctes.get(i);
            SqlNode definition = cte.getDefinitionNode();

            if (cte.getIndex() == maxIndex) {
                ranges.add(innerOrFull(definition));
                continue;
            }

            // Definitions end at their closing parenthesis
            SourceRange range = definition.getRange();
            if (i == 0) {
                range = extendToWithKeyword(definition, range);
            }
            ranges.add(range);
            addCommaRange(definition, ranges);
        }
        return ranges;
    }

    private static int selectedIndex(List<CteEntry> ctes, SqlNode targetQuery) {
        if (targetQuery.getType() == NodeType.NAMED_QUERY_DEFINITION) {
            for (CteEntry cte : ctes) {
                if (cte.getDefinitionNode() == targetQuery) return cte.getIndex();
            }
        }
        int max = -1;
        for (CteEntry cte : ctes) {
            max = Math.max(max, cte.getIndex());
        }
        return max;
    }

    private static List<SourceRange> buildSingleCteInnerRanges(List<CteEntry> ctes) {
        List<SourceRange> ranges = new ArrayList<>();
        for (CteEntry cte : ctes) {
            ranges.add(innerOrFull(cte.getDefinitionNode()));
        }
        return ranges;
    }

    private static List<SourceRange> buildDependenciesWithTargetInnerRanges(List<CteEntry> ctes) {
        List<SourceRange> ranges = new ArrayList<>();
        addCteChain(ctes.subList(0, ctes.size() - 1), ranges);
        ranges.add(innerOrFull(ctes.get(ctes.size() - 1).getDefinitionNode()));
        return ranges;
    }

    /**
     * Full definitions, the first stretched back to its WITH keyword, with commas between them.
     */
    private static void addCteChain(List<CteEntry> ctes, List<SourceRange> ranges) {
        for (int i = 0; i < ctes.size(); i++) {
            SqlNode definition = ctes.get(i).getDefinitionNode();
            SourceRange range = definition.getRange();
            if (i == 0) {
                range = extendToWithKeyword(definition, range);
            }
            ranges.add(range);
            if (i < ctes.size() - 1) {
                addCommaRange(definition, ranges);
            }
        }
    }

    private static SourceRange innerOrFull(SqlNode definition) {
        SourceRange inner = CteStructure.innerBodyRange(definition);
        return inner != null ? inner : definition.getRange();
    }

    private static SourceRange extendToWithKeyword(SqlNode definition, SourceRange range) {
        SqlNode withKeyword = CteStructure.findWithKeyword(definition);
        if (withKeyword == null) return range;
        return range.union(withKeyword.getRange());
    }

    private static void addCommaRange(SqlNode definition, List<SourceRange> ranges) {
        SqlNode comma = CteStructure.findSeparatorComma(definition);
        if (comma != null) {
            ranges.add(comma.getRange());
        }
    }
}
