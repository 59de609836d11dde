package com.ekslens.leadmaster.lead.model;

import java.util.List;
import java.util.Map;

public record LeadsOverview(
    long totalLeads,
    long totalMessages,
    Map<String, Long> leadsBySource,
    Map<String, Long> leadsByStatus,
    List<StoredLead> recentLeads
) {
}
