package org.dxworks.cteframe.builder;

import org.dxworks.cteframe.analyzer.SqlDependencyAnalyzer;
import org.dxworks.cteframe.model.BuildResult;
import org.dxworks.cteframe.model.CteEntry;
import org.dxworks.cteframe.model.ScopeAnalysis;
import org.dxworks.cteframe.model.SourceRange;
import org.dxworks.cteframe.tree.SqlNode;
import org.dxworks.cteframe.tree.antlr.AntlrSqlTree;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SqlBuilderTest {

    // a: [5, 20), body [11, 19); comma [20, 21); b: [22, 44), body [28, 43); main query [45, 60)
    private static final String TWO_CTES = "WITH a AS (SELECT 1), b AS (SELECT * FROM a) SELECT * FROM b;";

    private final ScopeAnalysis analysis = analyze(TWO_CTES, 59);
    private final List<CteEntry> all = analysis.getAllCtes();
    private final CteEntry a = all.get(0);
    private final CteEntry b = all.get(1);
    private final SqlNode mainQuery = analysis.getTargetQuery();

    @Test
    void fullCte_composesWithClauseAndTarget() {
        BuildResult result = SqlBuilder.build(List.of(a), mainQuery);

        assertEquals("WITH " + a.getDefinitionNode().getText() + "\n" + mainQuery.getText() + ";", result.getSql());
        assertEquals("WITH a AS (SELECT 1)\nSELECT * FROM b;", result.getSql());
    }

    @Test
    void fullCte_highlightsWithKeywordDefinitionsCommasAndTarget() {
        BuildResult result = SqlBuilder.build(all, mainQuery, all, HighlightMode.FULL_CTE);

        assertEquals("WITH a AS (SELECT 1),\nb AS (SELECT * FROM a)\nSELECT * FROM b;", result.getSql());
        assertEquals(List.of(new SourceRange(0, 20), new SourceRange(20, 21), new SourceRange(22, 44),
                new SourceRange(45, 60)), result.getHighlightSpans());
    }

    @Test
    void fullCte_cteTarget_selectsFromIt() {
        BuildResult result = SqlBuilder.build(List.of(a), b.getDefinitionNode());

        assertEquals("WITH a AS (SELECT 1)\nSELECT * FROM b;", result.getSql());
        assertEquals(List.of(new SourceRange(0, 20), new SourceRange(22, 44)), result.getHighlightSpans());
    }

    @Test
    void emptyCteList_isJustTheTarget() {
        for (HighlightMode mode : HighlightMode.values()) {
            BuildResult result = SqlBuilder.build(List.of(), mainQuery, all, mode);

            assertEquals("SELECT * FROM b;", result.getSql(), mode.name());
            assertEquals(List.of(new SourceRange(45, 60)), result.getHighlightSpans(), mode.name());
        }
    }

    @Test
    void progressive_selectedCteShowsBodyOnly() {
        BuildResult result = SqlBuilder.build(all, b.getDefinitionNode(), all, HighlightMode.PROGRESSIVE_CTE);

        assertEquals("WITH a AS (SELECT 1),\nb AS (SELECT * FROM a)\nSELECT * FROM b;", result.getSql());
        assertEquals(List.of(new SourceRange(0, 20), new SourceRange(20, 21), new SourceRange(28, 43)),
                result.getHighlightSpans());
    }

    @Test
    void progressive_singleCte_isBodyOnly() {
        BuildResult result = SqlBuilder.build(List.of(a), a.getDefinitionNode(), all, HighlightMode.PROGRESSIVE_CTE);

        assertEquals("WITH a AS (SELECT 1)\nSELECT * FROM a;", result.getSql());
        assertEquals(List.of(new SourceRange(11, 19)), result.getHighlightSpans());
    }

    @Test
    void progressive_threeCtes_earlierOnesInFull() {
        String sql = "WITH a AS (SELECT 1),\n  b AS (SELECT 2),\n  c AS (SELECT * FROM a, b)\nSELECT * FROM c";
        List<CteEntry> ctes = analyze(sql, sql.length() - 1).getAllCtes();
        SqlNode c = ctes.get(2).getDefinitionNode();

        BuildResult result = SqlBuilder.build(ctes, c, ctes, HighlightMode.PROGRESSIVE_CTE);

        int aEnd = sql.indexOf("),") + 1;
        int bStart = sql.indexOf("b AS");
        int bEnd = sql.indexOf("),", bStart) + 1;
        int cBody = sql.indexOf("SELECT * FROM a");
        assertEquals(List.of(
                new SourceRange(0, aEnd), new SourceRange(aEnd, aEnd + 1),
                new SourceRange(bStart, bEnd), new SourceRange(bEnd, bEnd + 1),
                new SourceRange(cBody, cBody + "SELECT * FROM a, b".length())), result.getHighlightSpans());
    }

    @Test
    void progressive_targetOutsideList_selectsHighestIndex() {
        BuildResult result = SqlBuilder.build(all, mainQuery, all, HighlightMode.PROGRESSIVE_CTE);

        assertEquals(new SourceRange(28, 43), result.getHighlightSpans().get(result.getHighlightSpans().size() - 1));
    }

    @Test
    void singleCteInner_highlightsEachBody() {
        BuildResult result = SqlBuilder.build(all, mainQuery, all, HighlightMode.SINGLE_CTE_INNER);

        assertEquals(List.of(new SourceRange(11, 19), new SourceRange(28, 43)), result.getHighlightSpans());
        assertEquals("WITH a AS (SELECT 1),\nb AS (SELECT * FROM a)\nSELECT * FROM b;", result.getSql());
    }

    @Test
    void dependenciesWithTargetInner_lastCteBodyBecomesStatement() {
        BuildResult result = SqlBuilder.build(all, b.getDefinitionNode(), all,
                HighlightMode.DEPENDENCIES_WITH_TARGET_INNER);

        assertEquals("WITH a AS (SELECT 1)\nSELECT * FROM a;", result.getSql());
        assertEquals(List.of(new SourceRange(0, 20), new SourceRange(28, 43)), result.getHighlightSpans());
    }

    @Test
    void dependenciesWithTargetInner_singleCte_isItsBody() {
        BuildResult result = SqlBuilder.build(List.of(a), a.getDefinitionNode(), all,
                HighlightMode.DEPENDENCIES_WITH_TARGET_INNER);

        assertEquals("SELECT 1;", result.getSql());
        assertEquals(List.of(new SourceRange(11, 19)), result.getHighlightSpans());
    }

    @Test
    void dependenciesWithTargetInner_emptyBody_fallsBackToSelectAll() {
        String sql = "WITH a AS () SELECT * FROM a";
        List<CteEntry> ctes = analyze(sql, sql.length() - 1).getAllCtes();

        BuildResult result = SqlBuilder.build(ctes, ctes.get(0).getDefinitionNode(), ctes,
                HighlightMode.DEPENDENCIES_WITH_TARGET_INNER);

        assertEquals("SELECT * FROM a;", result.getSql());
        assertEquals(List.of(ctes.get(0).getDefinitionNode().getRange()), result.getHighlightSpans());
    }

    @Test
    void build_isDeterministic() {
        BuildResult first = SqlBuilder.build(all, mainQuery, all, HighlightMode.PROGRESSIVE_CTE);
        BuildResult second = SqlBuilder.build(all, mainQuery, all, HighlightMode.PROGRESSIVE_CTE);

        assertEquals(first.getSql(), second.getSql());
        assertEquals(first.getHighlightSpans(), second.getHighlightSpans());
    }

    @Test
    void terminate_doesNotDoubleSemicolon() {
        assertEquals("SELECT 1;", SqlBuilder.terminate("SELECT 1"));
        assertEquals("SELECT 1;  ", SqlBuilder.terminate("SELECT 1;  "));
    }

    private static ScopeAnalysis analyze(String sql, int caret) {
        return new SqlDependencyAnalyzer(AntlrSqlTree.parse(sql), caret).analyze().getAnalysis();
    }
}
