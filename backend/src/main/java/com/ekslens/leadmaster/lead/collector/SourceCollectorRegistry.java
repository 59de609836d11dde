package com.ekslens.leadmaster.lead.collector;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Component
public class SourceCollectorRegistry {
    private final List<SourceCollector> collectors;

    public SourceCollectorRegistry(List<SourceCollector> collectors) {
        this.collectors = collectors.stream()
            .sorted(Comparator.comparingInt(SourceCollector::priority).thenComparing(SourceCollector::key))
            .toList();
    }

    public List<SourceCollector> ordered() {
        return collectors;
    }

    public List<String> keys() {
        return collectors.stream().map(SourceCollector::key).toList();
    }

    public Optional<SourceCollector> find(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return collectors.stream().filter(c -> c.key().equals(normalized)).findFirst();
    }
}
