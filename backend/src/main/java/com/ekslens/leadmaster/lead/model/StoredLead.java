package com.ekslens.leadmaster.lead.model;

import java.time.Instant;

public record StoredLead(
    long id,
    String displayName,
    String canonicalUrl,
    String description,
    String sourceName,
    String searchTermUsed,
    String industryName,
    String extractionMethod,
    String location,
    String email,
    String phone,
    LeadStatus status,
    Instant foundAt
) {
}
