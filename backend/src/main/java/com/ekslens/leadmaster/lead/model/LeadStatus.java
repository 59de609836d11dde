package com.ekslens.leadmaster.lead.model;

import java.util.Locale;

/**
 * Outreach lifecycle of a persisted lead. Only {@link #PENDING} is assigned by aggregation;
 * later states belong to the outreach workflows.
 */
public enum LeadStatus {
    PENDING,
    CONTACTED,
    RESPONDED,
    CONVERTED,
    DISCARDED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LeadStatus fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        try {
            return LeadStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return PENDING;
        }
    }
}
