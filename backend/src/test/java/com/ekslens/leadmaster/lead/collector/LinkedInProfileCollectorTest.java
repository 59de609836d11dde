package com.ekslens.leadmaster.lead.collector;

import com.ekslens.leadmaster.config.LeadMasterProperties;
import com.ekslens.leadmaster.lead.industry.MedicalAestheticsPolicy;
import com.ekslens.leadmaster.lead.model.CollectorResult;
import com.ekslens.leadmaster.lead.model.Lead;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class LinkedInProfileCollectorTest {
    private static final String ONE_PROFILE = """
        <li class="reusable-search__result-container">
          <a href="https://www.linkedin.com/in/ana-ruiz/"><span aria-hidden="true">Ana Ruiz</span></a>
          <div class="entity-result__primary-subtitle">Medicina estética</div>
          <div class="entity-result__secondary-subtitle">Madrid</div>
        </li>
        """;
    private static final String TWO_PROFILES = ONE_PROFILE + """
        <li class="reusable-search__result-container">
          <a href="https://www.linkedin.com/in/carlos-gil/"><span aria-hidden="true">Carlos Gil</span></a>
          <div class="entity-result__primary-subtitle">Distribuidor de fillers</div>
        </li>
        """;

    private final MedicalAestheticsPolicy policy = new MedicalAestheticsPolicy();
    private LeadMasterProperties properties;

    @BeforeEach
    void setUp() {
        properties = new LeadMasterProperties();
        LeadMasterProperties.LinkedIn linkedin = properties.getLinkedin();
        linkedin.setEnabled(true);
        linkedin.setEmail("ventas@example.es");
        linkedin.setPassword("secret");
        linkedin.setDelayMs(1);
        linkedin.setPagesPerTerm(2);
    }

    @Test
    void failedLoginReportsOneFailureAndClosesSession() {
        FakeSession session = new FakeSession(false, url -> TWO_PROFILES);

        CollectorResult result = collector(session).search(query(List.of("madrid"), List.of("botox"), 3));

        assertThat(result.leads()).isEmpty();
        assertThat(result.searchesPerformed()).isZero();
        assertThat(result.failedAttempts()).isEqualTo(1);
        assertThat(session.loaded).isEmpty();
        assertThat(session.closed).isTrue();
    }

    @Test
    void walksPagesUntilEmptyPage() {
        FakeSession session = new FakeSession(true, url -> url.endsWith("start=0") ? TWO_PROFILES : "");

        CollectorResult result = collector(session).search(query(List.of("madrid"), List.of("botox"), 1));

        assertThat(result.searchesPerformed()).isEqualTo(1);
        assertThat(session.loaded).hasSize(2);
        assertThat(session.loaded.get(0)).contains("keywords=botox%20madrid").endsWith("start=0");
        assertThat(session.loaded.get(1)).endsWith("start=10");
        assertThat(result.leads()).extracting(Lead::displayName).containsExactly("Ana Ruiz", "Carlos Gil");
        Lead ana = result.leads().get(0);
        assertThat(ana.canonicalUrl()).isEqualTo("https://www.linkedin.com/in/ana-ruiz");
        assertThat(ana.description()).isEqualTo("Medicina estética | Madrid");
        assertThat(ana.sourceName()).isEqualTo(LinkedInProfileCollector.SOURCE_NAME);
        assertThat(ana.searchTermUsed()).isEqualTo("botox madrid");
        assertThat(result.leads().get(1).location()).isEqualTo("madrid");
        assertThat(session.closed).isTrue();
    }

    @Test
    void sameProfileAcrossTermsIsReturnedOnce() {
        properties.getLinkedin().setPagesPerTerm(1);
        FakeSession session = new FakeSession(true, url -> ONE_PROFILE);

        CollectorResult result = collector(session).search(query(List.of("madrid"), List.of("botox"), 2));

        assertThat(result.searchesPerformed()).isEqualTo(2);
        assertThat(result.leads()).hasSize(1);
    }

    @Test
    void stopSignalEndsWalk() {
        FakeSession session = new FakeSession(true, url -> TWO_PROFILES);
        CollectorQuery stopped = new CollectorQuery(policy, List.of("madrid"), List.of("botox"), 5, () -> true);

        CollectorResult result = collector(session).search(stopped);

        assertThat(result.searchesPerformed()).isZero();
        assertThat(session.loaded).isEmpty();
    }

    @Test
    void citiesAreCappedByConfiguration() {
        properties.getLinkedin().setMaxCities(1);
        properties.getLinkedin().setPagesPerTerm(1);
        FakeSession session = new FakeSession(true, url -> "");

        collector(session).search(query(List.of("madrid", "sevilla"), List.of("aesthetic clinic"), 10));

        assertThat(session.loaded).isNotEmpty().allMatch(url -> !url.contains("sevilla"));
    }

    @Test
    void searchTermsCombineKeywordsCitiesAndVariations() {
        LinkedInProfileCollector collector = collector(new FakeSession(true, url -> ""));

        List<String> terms = collector.buildSearchTerms(
            policy,
            "madrid",
            List.of("botox", "aesthetic clinic", "fillers", "profhilo")
        );

        assertThat(terms).containsExactly(
            "botox madrid",
            "botox",
            "especialista botox madrid",
            "doctor botox madrid",
            "aesthetic clinic madrid",
            "aesthetic clinic",
            "fillers madrid",
            "fillers"
        );
    }

    @Test
    void unavailableWithoutCredentials() {
        properties.getLinkedin().setPassword(" ");
        FakeSession session = new FakeSession(true, url -> TWO_PROFILES);

        LinkedInProfileCollector collector = collector(session);

        assertThat(collector.available()).isFalse();
        assertThat(collector.search(query(List.of("madrid"), List.of("botox"), 2))).isEqualTo(CollectorResult.empty());
    }

    private LinkedInProfileCollector collector(FakeSession session) {
        return new LinkedInProfileCollector(properties, () -> session, new ProfileSearchPageParser());
    }

    private CollectorQuery query(List<String> cities, List<String> keywords, int budget) {
        return new CollectorQuery(policy, cities, keywords, budget, () -> false);
    }

    private static final class FakeSession implements BrowserSession {
        private final boolean loginSucceeds;
        private final Function<String, String> pages;
        private final List<String> loaded = new ArrayList<>();
        private boolean closed;

        private FakeSession(boolean loginSucceeds, Function<String, String> pages) {
            this.loginSucceeds = loginSucceeds;
            this.pages = pages;
        }

        @Override
        public boolean login(String loginUrl, String username, String password) {
            return loginSucceeds;
        }

        @Override
        public String loadPage(String url) {
            loaded.add(url);
            return pages.apply(url);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
