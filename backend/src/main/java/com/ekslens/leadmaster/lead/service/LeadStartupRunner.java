package com.ekslens.leadmaster.lead.service;

import com.ekslens.leadmaster.lead.augment.TextAugmenter;
import com.ekslens.leadmaster.lead.collector.SourceCollector;
import com.ekslens.leadmaster.lead.collector.SourceCollectorRegistry;
import com.ekslens.leadmaster.lead.job.JobState;
import com.ekslens.leadmaster.lead.persistence.LeadStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Reports which collaborators are configured when the process starts. Job state always starts
 * idle; there is nothing to recover from a previous process.
 */
@Component
@Order(0)
public class LeadStartupRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(LeadStartupRunner.class);

    private final LeadStore store;
    private final SourceCollectorRegistry collectorRegistry;
    private final TextAugmenter augmenter;
    private final LeadAggregationService aggregationService;
    private final JobState jobState;

    public LeadStartupRunner(
        LeadStore store,
        SourceCollectorRegistry collectorRegistry,
        TextAugmenter augmenter,
        LeadAggregationService aggregationService,
        JobState jobState
    ) {
        this.store = store;
        this.collectorRegistry = collectorRegistry;
        this.augmenter = augmenter;
        this.aggregationService = aggregationService;
        this.jobState = jobState;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!store.isReachable()) {
            log.warn("Lead database is unreachable; searches will not be able to save leads");
        }
        StringBuilder sources = new StringBuilder();
        for (SourceCollector collector : collectorRegistry.ordered()) {
            if (sources.length() > 0) {
                sources.append(", ");
            }
            sources.append(collector.sourceName()).append(collector.available() ? "=ready" : "=not configured");
        }
        jobState.info(
            "Lead master ready for " + aggregationService.currentIndustry().name()
                + " (" + sources + ", drafts=" + (augmenter.isConfigured() ? "ready" : "not configured") + ")"
        );
    }
}
