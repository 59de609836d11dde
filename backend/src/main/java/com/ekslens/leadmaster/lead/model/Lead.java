package com.ekslens.leadmaster.lead.model;

import java.time.Instant;

public record Lead(
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
    Instant foundAt
) {
    public boolean hasDisplayName() {
        return displayName != null && !displayName.isBlank();
    }

    public boolean hasCanonicalUrl() {
        return canonicalUrl != null && !canonicalUrl.isBlank();
    }

    public Lead withIndustryName(String industry) {
        return new Lead(
            displayName,
            canonicalUrl,
            description,
            sourceName,
            searchTermUsed,
            industry,
            extractionMethod,
            location,
            email,
            phone,
            foundAt
        );
    }
}
