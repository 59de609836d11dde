package com.ekslens.leadmaster.lead.model;

import java.util.List;

public record CollectorResult(List<Lead> leads, int searchesPerformed, int failedAttempts) {
    public CollectorResult {
        leads = leads == null ? List.of() : List.copyOf(leads);
    }

    public static CollectorResult empty() {
        return new CollectorResult(List.of(), 0, 0);
    }
}
