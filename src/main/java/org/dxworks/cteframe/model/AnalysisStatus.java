package org.dxworks.cteframe.model;

public enum AnalysisStatus {
    ANALYZED,
    /** The cursor is not inside any WITH-bearing query. */
    NO_SCOPE,
    /** A WITH clause encloses the cursor but defines no CTEs. */
    NO_CTES
}
