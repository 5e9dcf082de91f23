package org.dxworks.cteframe.model;

import java.util.List;

/**
 * Standalone SQL plus the source spans it was assembled from.
 * The spans point into the original document, not into {@link #getSql()}.
 */
public final class BuildResult {

    private final String sql;
    private final List<SourceRange> highlightSpans;

    public BuildResult(String sql, List<SourceRange> highlightSpans) {
        this.sql = sql;
        this.highlightSpans = List.copyOf(highlightSpans);
    }

    public String getSql() {
        return sql;
    }

    public List<SourceRange> getHighlightSpans() {
        return highlightSpans;
    }
}
