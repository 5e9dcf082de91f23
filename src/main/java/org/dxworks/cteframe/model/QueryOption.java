package org.dxworks.cteframe.model;

import java.util.List;

/**
 * One selectable query: a label, the SQL it runs and the source spans to emphasise while it is selected.
 */
public final class QueryOption {

    private final String displayName;
    private final String sql;
    private final List<SourceRange> highlightSpans;

    public QueryOption(String displayName, String sql, List<SourceRange> highlightSpans) {
        this.displayName = displayName;
        this.sql = sql;
        this.highlightSpans = List.copyOf(highlightSpans);
    }

    public static QueryOption of(String displayName, BuildResult result) {
        return new QueryOption(displayName, result.getSql(), result.getHighlightSpans());
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getSql() {
        return sql;
    }

    public List<SourceRange> getHighlightSpans() {
        return highlightSpans;
    }
}
