package com.ekslens.leadmaster.lead.model;

public record PhaseSummary(
    String phase,
    String source,
    PhaseStatus status,
    int searchesPerformed,
    int leadsFound,
    int rejected,
    int duplicates,
    int saved,
    int failures,
    String note
) {
    public static PhaseSummary skipped(String phase, String source, String note) {
        return new PhaseSummary(phase, source, PhaseStatus.SKIPPED, 0, 0, 0, 0, 0, 0, note);
    }
}
