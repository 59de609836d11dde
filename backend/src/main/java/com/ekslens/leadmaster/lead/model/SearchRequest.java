package com.ekslens.leadmaster.lead.model;

import java.util.List;
import java.util.Locale;
import java.util.Set;

public record SearchRequest(
    String industryId,
    List<String> cities,
    List<String> keywords,
    int maxSearches,
    Set<String> enabledSources
) {
    public SearchRequest {
        cities = cities == null ? List.of() : List.copyOf(cities);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        enabledSources = enabledSources == null ? Set.of() : Set.copyOf(enabledSources);
        maxSearches = Math.max(1, maxSearches);
    }

    public boolean isSourceEnabled(String sourceKey) {
        return sourceKey != null && enabledSources.contains(sourceKey.toLowerCase(Locale.ROOT));
    }
}
