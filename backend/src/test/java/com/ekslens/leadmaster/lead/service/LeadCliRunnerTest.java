package com.ekslens.leadmaster.lead.service;

import com.ekslens.leadmaster.config.LeadMasterProperties;
import com.ekslens.leadmaster.lead.collector.SourceCollectorRegistry;
import com.ekslens.leadmaster.lead.industry.RealEstatePolicy;
import com.ekslens.leadmaster.lead.model.JobLifecycle;
import com.ekslens.leadmaster.lead.model.SearchRequest;
import com.ekslens.leadmaster.lead.model.SessionReport;
import com.ekslens.leadmaster.lead.model.SessionStatsSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LeadCliRunnerTest {

    @Mock
    private LeadAggregationService aggregationService;
    @Mock
    private ConfigurableApplicationContext applicationContext;

    @Test
    void doesNothingUnlessEnabled() {
        LeadMasterProperties properties = new LeadMasterProperties();

        runner(properties).run(new DefaultApplicationArguments());

        verifyNoInteractions(aggregationService);
    }

    @Test
    void runsConfiguredSearchSynchronously() {
        LeadMasterProperties properties = new LeadMasterProperties();
        LeadMasterProperties.Cli cli = properties.getCli();
        cli.setRun(true);
        cli.setExitAfterRun(false);
        cli.setIndustry("real_estate");
        cli.setCities(" Madrid, ,Sevilla ");
        cli.setKeywords("inmobiliaria");
        cli.setMaxSearches(2);
        when(aggregationService.changeIndustry("real_estate")).thenReturn(new RealEstatePolicy());
        when(aggregationService.run(any())).thenReturn(report());

        runner(properties).run(new DefaultApplicationArguments());

        ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
        verify(aggregationService).run(captor.capture());
        SearchRequest request = captor.getValue();
        assertThat(request.industryId()).isEqualTo(RealEstatePolicy.ID);
        assertThat(request.cities()).containsExactly("madrid", "sevilla");
        assertThat(request.keywords()).containsExactly("inmobiliaria");
        assertThat(request.maxSearches()).isEqualTo(2);
    }

    private LeadCliRunner runner(LeadMasterProperties properties) {
        SearchRequestFactory factory = new SearchRequestFactory(properties, new SourceCollectorRegistry(List.of()));
        return new LeadCliRunner(properties, aggregationService, factory, applicationContext);
    }

    private static SessionReport report() {
        Instant now = Instant.now();
        return new SessionReport(
            RealEstatePolicy.ID,
            "Real Estate",
            JobLifecycle.COMPLETED,
            now,
            now,
            new SessionStatsSnapshot("Real Estate", 2, 0, 0, 0, 0, 0, 0.0),
            List.of(),
            Map.of(),
            List.of(),
            List.of()
        );
    }
}
