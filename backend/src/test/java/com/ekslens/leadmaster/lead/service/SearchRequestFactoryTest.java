package com.ekslens.leadmaster.lead.service;

import com.ekslens.leadmaster.config.LeadMasterProperties;
import com.ekslens.leadmaster.lead.collector.CollectorQuery;
import com.ekslens.leadmaster.lead.collector.SourceCollector;
import com.ekslens.leadmaster.lead.collector.SourceCollectorRegistry;
import com.ekslens.leadmaster.lead.industry.MedicalAestheticsPolicy;
import com.ekslens.leadmaster.lead.model.CollectorResult;
import com.ekslens.leadmaster.lead.model.SearchRequest;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchRequestFactoryTest {
    private final MedicalAestheticsPolicy policy = new MedicalAestheticsPolicy();

    @Test
    void fillsDefaultsWhenInputMissing() {
        SearchRequestFactory factory = factory(new LeadMasterProperties());

        SearchRequest request = factory.create(policy, null, List.of(), null, null);

        assertThat(request.industryId()).isEqualTo(MedicalAestheticsPolicy.ID);
        assertThat(request.cities()).containsExactly("madrid", "barcelona", "valencia");
        assertThat(request.keywords()).containsExactlyElementsOf(policy.defaultKeywords().subList(0, 5));
        assertThat(request.maxSearches()).isEqualTo(10);
        assertThat(request.enabledSources()).containsExactlyInAnyOrder("serpapi", "linkedin");
    }

    @Test
    void cleansAndDeduplicatesInput() {
        SearchRequestFactory factory = factory(new LeadMasterProperties());

        SearchRequest request = factory.create(
            policy,
            Arrays.asList(" Madrid ", "madrid", null, "", "San  Sebastián"),
            Arrays.asList("botox", "  botox", "fillers"),
            4,
            null
        );

        assertThat(request.cities()).containsExactly("madrid", "san sebastián");
        assertThat(request.keywords()).containsExactly("botox", "fillers");
        assertThat(request.maxSearches()).isEqualTo(4);
    }

    @Test
    void rejectsBudgetAboveConfiguredMaximum() {
        LeadMasterProperties properties = new LeadMasterProperties();
        properties.getSearch().setMaxSearches(5);
        SearchRequestFactory factory = factory(properties);

        assertThatThrownBy(() -> factory.create(policy, null, null, 6, null))
            .isInstanceOf(InvalidSearchRequestException.class)
            .hasMessageContaining("At most 5 searches");
    }

    @Test
    void rejectsTooManyCities() {
        LeadMasterProperties properties = new LeadMasterProperties();
        properties.getSearch().setMaxCities(2);
        SearchRequestFactory factory = factory(properties);

        assertThatThrownBy(() -> factory.create(policy, List.of("madrid", "bilbao", "malaga"), null, null, null))
            .isInstanceOf(InvalidSearchRequestException.class);
    }

    @Test
    void sourceFlagsSelectCollectors() {
        SearchRequestFactory factory = factory(new LeadMasterProperties());
        Map<String, Boolean> sources = new LinkedHashMap<>();
        sources.put("SerpApi", true);
        sources.put("linkedin", false);

        SearchRequest request = factory.create(policy, null, null, 1, sources);

        assertThat(request.isSourceEnabled("serpapi")).isTrue();
        assertThat(request.isSourceEnabled("linkedin")).isFalse();
    }

    @Test
    void unknownSourceIsRejected() {
        SearchRequestFactory factory = factory(new LeadMasterProperties());

        assertThatThrownBy(() -> factory.create(policy, null, null, 1, Map.of("yellowpages", true)))
            .isInstanceOf(InvalidSearchRequestException.class)
            .hasMessageContaining("yellowpages");
    }

    @Test
    void zeroBudgetIsRaisedToOne() {
        SearchRequestFactory factory = factory(new LeadMasterProperties());

        assertThat(factory.create(policy, null, null, 0, null).maxSearches()).isEqualTo(1);
    }

    private static SearchRequestFactory factory(LeadMasterProperties properties) {
        return new SearchRequestFactory(
            properties,
            new SourceCollectorRegistry(List.of(new NamedCollector("serpapi", 10), new NamedCollector("linkedin", 20)))
        );
    }

    private record NamedCollector(String key, int priority) implements SourceCollector {
        @Override
        public String sourceName() {
            return key;
        }

        @Override
        public boolean available() {
            return true;
        }

        @Override
        public CollectorResult search(CollectorQuery query) {
            return CollectorResult.empty();
        }
    }
}
