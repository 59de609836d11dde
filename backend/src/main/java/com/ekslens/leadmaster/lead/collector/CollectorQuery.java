package com.ekslens.leadmaster.lead.collector;

import com.ekslens.leadmaster.lead.industry.IndustryPolicy;

import java.util.List;
import java.util.function.BooleanSupplier;

public record CollectorQuery(
    IndustryPolicy policy,
    List<String> cities,
    List<String> keywords,
    int budget,
    BooleanSupplier stopSignal
) {
    public CollectorQuery {
        cities = cities == null ? List.of() : List.copyOf(cities);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        budget = Math.max(0, budget);
    }

    public boolean isStopRequested() {
        return stopSignal != null && stopSignal.getAsBoolean();
    }
}
