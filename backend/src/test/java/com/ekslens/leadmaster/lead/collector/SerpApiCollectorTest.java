package com.ekslens.leadmaster.lead.collector;

import com.ekslens.leadmaster.config.LeadMasterProperties;
import com.ekslens.leadmaster.lead.http.RateLimitedHttpClient;
import com.ekslens.leadmaster.lead.industry.MedicalAestheticsPolicy;
import com.ekslens.leadmaster.lead.model.CollectorResult;
import com.ekslens.leadmaster.lead.model.Lead;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

class SerpApiCollectorTest {
    private static final String TWO_RESULTS = """
        {
          "search_metadata": {"status": "Success"},
          "organic_results": [
            {"position": 1, "title": "Clínica Botox Madrid", "link": "https://botox-madrid.es", "snippet": "Tratamientos de botox"},
            {"position": 2, "title": "Dermaclinic", "link": "https://dermaclinic.es", "snippet": "Fillers y ácido hialurónico"},
            {"position": 3, "link": "https://untitled.es"}
          ]
        }
        """;

    private MockWebServer server;
    private ExecutorService executor;
    private LeadMasterProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        properties = new LeadMasterProperties();
        properties.setRequestMaxRetries(0);
        properties.getSerpapi().setApiKey("test-key");
        properties.getSerpapi().setBaseUrl(server.url("/search.json").toString());
        properties.getSerpapi().setDelayMs(1);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void mapsOrganicResultsToLeads() throws Exception {
        server.enqueue(json(TWO_RESULTS));
        SerpApiCollector collector = collector();

        CollectorResult result = collector.search(query(List.of("madrid"), List.of("botox"), 5, () -> false));

        assertThat(result.searchesPerformed()).isEqualTo(1);
        assertThat(result.failedAttempts()).isZero();
        assertThat(result.leads()).extracting(Lead::displayName).containsExactly("Clínica Botox Madrid", "Dermaclinic");
        Lead first = result.leads().get(0);
        assertThat(first.canonicalUrl()).isEqualTo("https://botox-madrid.es");
        assertThat(first.description()).isEqualTo("Tratamientos de botox");
        assertThat(first.sourceName()).isEqualTo(SerpApiCollector.SOURCE_NAME);
        assertThat(first.searchTermUsed()).isEqualTo("botox madrid");
        assertThat(first.extractionMethod()).isEqualTo("organic-search");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getRequestUrl().queryParameter("engine")).isEqualTo("google");
        assertThat(request.getRequestUrl().queryParameter("api_key")).isEqualTo("test-key");
        assertThat(request.getRequestUrl().queryParameter("gl")).isEqualTo("es");
        assertThat(request.getRequestUrl().queryParameter("q")).contains("\"botox\"");
    }

    @Test
    void stopsAtBudgetIteratingCitiesOutermost() throws Exception {
        for (int i = 0; i < 3; i++) {
            server.enqueue(json("{\"organic_results\": []}"));
        }
        SerpApiCollector collector = collector();

        CollectorResult result = collector.search(
            query(List.of("madrid", "barcelona"), List.of("botox", "fillers"), 3, () -> false)
        );

        assertThat(result.searchesPerformed()).isEqualTo(3);
        assertThat(server.getRequestCount()).isEqualTo(3);
        assertThat(server.takeRequest().getRequestUrl().queryParameter("location")).isEqualTo("madrid");
        assertThat(server.takeRequest().getRequestUrl().queryParameter("location")).isEqualTo("madrid");
        assertThat(server.takeRequest().getRequestUrl().queryParameter("location")).isEqualTo("barcelona");
    }

    @Test
    void errorPayloadAndHttpFailuresCountAsFailedAttempts() {
        server.enqueue(json("{\"error\": \"Invalid API key.\"}"));
        server.enqueue(new MockResponse().setResponseCode(500));
        SerpApiCollector collector = collector();

        CollectorResult result = collector.search(query(List.of("madrid"), List.of("botox", "fillers"), 5, () -> false));

        assertThat(result.leads()).isEmpty();
        assertThat(result.searchesPerformed()).isEqualTo(2);
        assertThat(result.failedAttempts()).isEqualTo(2);
    }

    @Test
    void stopSignalEndsSearchBetweenRequests() {
        server.enqueue(json(TWO_RESULTS));
        server.enqueue(json(TWO_RESULTS));
        AtomicInteger checks = new AtomicInteger();
        SerpApiCollector collector = collector();

        CollectorResult result = collector.search(
            query(List.of("madrid"), List.of("botox", "fillers"), 5, () -> checks.incrementAndGet() > 1)
        );

        assertThat(result.searchesPerformed()).isEqualTo(1);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void unavailableWithoutApiKey() {
        properties.getSerpapi().setApiKey("");
        SerpApiCollector collector = collector();

        assertThat(collector.available()).isFalse();
        assertThat(collector.search(query(List.of("madrid"), List.of("botox"), 5, () -> false)).searchesPerformed()).isZero();
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void buildUrlEncodesParameters() {
        String url = SerpApiCollector.buildUrl("https://serpapi.com/search.json", Map.of("q", "ácido hialurónico"));

        assertThat(url).isEqualTo("https://serpapi.com/search.json?q=%C3%A1cido+hialur%C3%B3nico");
    }

    private SerpApiCollector collector() {
        return new SerpApiCollector(properties, new RateLimitedHttpClient(properties, executor), new ObjectMapper());
    }

    private static CollectorQuery query(
        List<String> cities,
        List<String> keywords,
        int budget,
        BooleanSupplier stop
    ) {
        return new CollectorQuery(new MedicalAestheticsPolicy(), cities, keywords, budget, stop);
    }

    private static MockResponse json(String body) {
        return new MockResponse().setResponseCode(200).setHeader("Content-Type", "application/json").setBody(body);
    }
}
