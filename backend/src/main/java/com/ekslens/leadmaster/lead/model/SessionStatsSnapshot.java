package com.ekslens.leadmaster.lead.model;

public record SessionStatsSnapshot(
    String industry,
    int searchesPerformed,
    int leadsFound,
    int leadsSaved,
    int duplicatesResolved,
    int rejected,
    int messagesDrafted,
    double executionSeconds
) {
    public static SessionStatsSnapshot empty(String industry) {
        return new SessionStatsSnapshot(industry, 0, 0, 0, 0, 0, 0, 0.0);
    }
}
