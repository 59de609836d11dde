package com.ekslens.leadmaster.lead.api;

import java.util.List;
import java.util.Map;

public record SearchApiRequest(
    String industry,
    List<String> cities,
    List<String> keywords,
    Integer maxSearches,
    Map<String, Boolean> sources
) {
}
