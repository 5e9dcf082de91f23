package org.dxworks.cteframe.model;

/**
 * Either a {@link ScopeAnalysis} or the reason there is nothing to analyse.
 * Callers treat the not-applicable statuses as "do nothing", never as errors.
 */
public final class AnalysisOutcome {

    private static final AnalysisOutcome NO_SCOPE = new AnalysisOutcome(AnalysisStatus.NO_SCOPE, null);
    private static final AnalysisOutcome NO_CTES = new AnalysisOutcome(AnalysisStatus.NO_CTES, null);

    private final AnalysisStatus status;
    private final ScopeAnalysis analysis;

    private AnalysisOutcome(AnalysisStatus status, ScopeAnalysis analysis) {
        this.status = status;
        this.analysis = analysis;
    }

    public static AnalysisOutcome analyzed(ScopeAnalysis analysis) {
        if (analysis == null) {
            throw new IllegalArgumentException("analysis must not be null");
        }
        return new AnalysisOutcome(AnalysisStatus.ANALYZED, analysis);
    }

    public static AnalysisOutcome noScope() {
        return NO_SCOPE;
    }

    public static AnalysisOutcome noCtes() {
        return NO_CTES;
    }

    public AnalysisStatus getStatus() {
        return status;
    }

    public boolean isApplicable() {
        return status == AnalysisStatus.ANALYZED;
    }

    /**
     * @throws IllegalStateException when the outcome is not applicable
     */
    public ScopeAnalysis getAnalysis() {
        if (analysis == null) {
            throw new IllegalStateException("No analysis available: " + status);
        }
        return analysis;
    }
}
