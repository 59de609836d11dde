package com.ekslens.leadmaster.lead.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record SessionReport(
    String industryId,
    String industry,
    JobLifecycle status,
    Instant startedAt,
    Instant finishedAt,
    SessionStatsSnapshot stats,
    List<PhaseSummary> phases,
    Map<String, Integer> leadsBySource,
    List<LeadSample> sampleLeads,
    List<DraftedMessage> drafts
) {
}
