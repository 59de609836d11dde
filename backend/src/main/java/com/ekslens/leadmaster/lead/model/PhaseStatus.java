package com.ekslens.leadmaster.lead.model;

public enum PhaseStatus {
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    SKIPPED,
    FAILED,
    CANCELLED
}
