package com.ekslens.leadmaster.lead.service;

import com.ekslens.leadmaster.config.LeadMasterProperties;
import com.ekslens.leadmaster.lead.collector.SourceCollector;
import com.ekslens.leadmaster.lead.collector.SourceCollectorRegistry;
import com.ekslens.leadmaster.lead.industry.IndustryPolicy;
import com.ekslens.leadmaster.lead.model.SearchRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns caller input into a bounded {@link SearchRequest}: blank entries are dropped, missing
 * cities and keywords fall back to defaults, and requests over the configured limits are
 * rejected before any job state changes.
 */
@Component
public class SearchRequestFactory {
    private final LeadMasterProperties properties;
    private final SourceCollectorRegistry collectorRegistry;

    public SearchRequestFactory(LeadMasterProperties properties, SourceCollectorRegistry collectorRegistry) {
        this.properties = properties;
        this.collectorRegistry = collectorRegistry;
    }

    public SearchRequest create(
        IndustryPolicy policy,
        List<String> cities,
        List<String> keywords,
        Integer maxSearches,
        Map<String, Boolean> sources
    ) {
        LeadMasterProperties.Search limits = properties.getSearch();

        List<String> cleanCities = clean(cities, true);
        if (cleanCities.size() > limits.getMaxCities()) {
            throw new InvalidSearchRequestException(
                "At most " + limits.getMaxCities() + " cities per search, got " + cleanCities.size()
            );
        }
        if (cleanCities.isEmpty()) {
            cleanCities = clean(limits.getDefaultCities(), true);
        }

        List<String> cleanKeywords = clean(keywords, false);
        if (cleanKeywords.size() > limits.getMaxKeywords()) {
            throw new InvalidSearchRequestException(
                "At most " + limits.getMaxKeywords() + " keywords per search, got " + cleanKeywords.size()
            );
        }
        if (cleanKeywords.isEmpty()) {
            List<String> defaults = policy.defaultKeywords();
            cleanKeywords = List.copyOf(defaults.subList(0, Math.min(limits.getDefaultKeywordCount(), defaults.size())));
        }

        int budget = maxSearches == null ? limits.getMaxSearches() : maxSearches;
        if (budget > limits.getMaxSearches()) {
            throw new InvalidSearchRequestException(
                "At most " + limits.getMaxSearches() + " searches per run, got " + budget
            );
        }
        budget = Math.max(1, budget);

        return new SearchRequest(policy.id(), cleanCities, cleanKeywords, budget, enabledSources(sources));
    }

    private Set<String> enabledSources(Map<String, Boolean> sources) {
        Set<String> enabled = new LinkedHashSet<>();
        if (sources == null || sources.isEmpty()) {
            enabled.addAll(collectorRegistry.keys());
            return enabled;
        }
        for (Map.Entry<String, Boolean> entry : sources.entrySet()) {
            SourceCollector collector = collectorRegistry.find(entry.getKey())
                .orElseThrow(() -> new InvalidSearchRequestException(
                    "Unknown source '" + entry.getKey() + "', expected one of " + collectorRegistry.keys()
                ));
            if (Boolean.TRUE.equals(entry.getValue())) {
                enabled.add(collector.key());
            }
        }
        return enabled;
    }

    private static List<String> clean(List<String> values, boolean lowerCase) {
        if (values == null) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String normalized = value.trim().replaceAll("\\s+", " ");
            if (lowerCase) {
                normalized = normalized.toLowerCase(Locale.ROOT);
            }
            if (!normalized.isEmpty()) {
                out.add(normalized);
            }
        }
        return new ArrayList<>(out);
    }
}
