package com.ekslens.leadmaster.lead.service;

import com.ekslens.leadmaster.config.LeadMasterProperties;
import com.ekslens.leadmaster.lead.industry.IndustryPolicy;
import com.ekslens.leadmaster.lead.model.JobLifecycle;
import com.ekslens.leadmaster.lead.model.PhaseSummary;
import com.ekslens.leadmaster.lead.model.SearchRequest;
import com.ekslens.leadmaster.lead.model.SessionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
public class LeadCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(LeadCliRunner.class);

    private final LeadMasterProperties properties;
    private final LeadAggregationService aggregationService;
    private final SearchRequestFactory searchRequestFactory;
    private final ConfigurableApplicationContext applicationContext;

    public LeadCliRunner(
        LeadMasterProperties properties,
        LeadAggregationService aggregationService,
        SearchRequestFactory searchRequestFactory,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.aggregationService = aggregationService;
        this.searchRequestFactory = searchRequestFactory;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        LeadMasterProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        IndustryPolicy policy = cli.getIndustry() == null || cli.getIndustry().isBlank()
            ? aggregationService.currentIndustry()
            : aggregationService.changeIndustry(cli.getIndustry());
        SearchRequest request = searchRequestFactory.create(
            policy,
            split(cli.getCities()),
            split(cli.getKeywords()),
            cli.getMaxSearches(),
            null
        );

        SessionReport report = aggregationService.run(request);
        log.info(
            "Lead search for {} finished with status {}: searches={}, found={}, saved={}, duplicates={}, drafts={}",
            report.industry(),
            report.status(),
            report.stats().searchesPerformed(),
            report.stats().leadsFound(),
            report.stats().leadsSaved(),
            report.stats().duplicatesResolved(),
            report.stats().messagesDrafted()
        );
        for (PhaseSummary phase : report.phases()) {
            log.info(
                "Phase {}: status={}, searches={}, found={}, saved={}, duplicates={}, rejected={}, failures={}",
                phase.phase(),
                phase.status(),
                phase.searchesPerformed(),
                phase.leadsFound(),
                phase.saved(),
                phase.duplicates(),
                phase.rejected(),
                phase.failures()
            );
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(
                applicationContext,
                () -> report.status() == JobLifecycle.FAILED ? 1 : 0
            );
            System.exit(exitCode);
        }
    }

    private static List<String> split(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
    }
}
