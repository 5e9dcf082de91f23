package org.dxworks.cteframe.builder;

/**
 * Decides both how SQL is assembled and which source spans are highlighted.
 */
public enum HighlightMode {
    /**
     * Full CTE definitions (the first one including the WITH keyword), their separating commas and the target query.
     */
    FULL_CTE,

    /**
     * CTEs up to the selected one; the selected CTE only shows its inner query.
     */
    PROGRESSIVE_CTE,

    /**
     * Inner query of each given CTE. Highlight only.
     */
    SINGLE_CTE_INNER,

    /**
     * All CTEs but the last in full, the last one as its inner query, which also becomes the final statement.
     */
    DEPENDENCIES_WITH_TARGET_INNER
}
