package com.ekslens.leadmaster.lead.collector;

import com.ekslens.leadmaster.config.LeadMasterProperties;
import com.ekslens.leadmaster.lead.http.RateLimitedHttpClient;
import com.ekslens.leadmaster.lead.industry.IndustryPolicy;
import com.ekslens.leadmaster.lead.model.CollectorResult;
import com.ekslens.leadmaster.lead.model.HttpFetchResult;
import com.ekslens.leadmaster.lead.model.Lead;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Google organic results through the SerpApi JSON endpoint. One search per keyword and city
 * pair, cities outermost, until the budget is spent.
 */
@Component
public class SerpApiCollector implements SourceCollector {
    private static final Logger log = LoggerFactory.getLogger(SerpApiCollector.class);

    public static final String KEY = "serpapi";
    public static final String SOURCE_NAME = "SerpApi";
    static final String EXTRACTION_METHOD = "organic-search";

    private final LeadMasterProperties properties;
    private final RateLimitedHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public SerpApiCollector(
        LeadMasterProperties properties,
        RateLimitedHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public String sourceName() {
        return SOURCE_NAME;
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean available() {
        return properties.getSerpapi().isConfigured();
    }

    @Override
    public CollectorResult search(CollectorQuery query) {
        if (!available() || query == null || query.policy() == null) {
            return CollectorResult.empty();
        }
        List<Lead> leads = new ArrayList<>();
        int searches = 0;
        int failures = 0;
        outer:
        for (String city : query.cities()) {
            for (String keyword : query.keywords()) {
                if (searches >= query.budget() || query.isStopRequested()) {
                    break outer;
                }
                searches++;
                try {
                    List<Lead> found = searchOnce(query.policy(), keyword, city);
                    if (found == null) {
                        failures++;
                    } else {
                        leads.addAll(found);
                    }
                } catch (RuntimeException e) {
                    failures++;
                    log.warn("SerpApi search failed for '{}' in {}", keyword, city, e);
                }
            }
        }
        log.info("SerpApi collected {} results from {} searches ({} failed)", leads.size(), searches, failures);
        return new CollectorResult(leads, searches, failures);
    }

    private List<Lead> searchOnce(IndustryPolicy policy, String keyword, String city) {
        LeadMasterProperties.SerpApi config = properties.getSerpapi();
        Map<String, String> params = new LinkedHashMap<>(policy.buildSearchParams(keyword, city));
        params.put("engine", "google");
        params.put("api_key", config.getApiKey());

        HttpFetchResult result = httpClient.get(
            buildUrl(config.getBaseUrl(), params),
            "application/json",
            Duration.ofMillis(config.getDelayMs())
        );
        if (!result.isSuccessful() || result.body() == null) {
            log.warn("SerpApi request for '{}' in {} failed: {}", keyword, city, result.describeFailure());
            return null;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(result.body());
        } catch (JsonProcessingException e) {
            log.warn("SerpApi returned unparseable JSON for '{}' in {}", keyword, city, e);
            return null;
        }
        if (root.hasNonNull("error")) {
            log.warn("SerpApi error for '{}' in {}: {}", keyword, city, root.path("error").asText());
            return null;
        }

        List<Lead> leads = new ArrayList<>();
        Instant foundAt = Instant.now();
        String searchTerm = keyword + " " + city;
        for (JsonNode organic : root.path("organic_results")) {
            if (leads.size() >= config.getResultsPerSearch()) {
                break;
            }
            String title = textOrNull(organic, "title");
            if (title == null) {
                continue;
            }
            leads.add(new Lead(
                title,
                textOrNull(organic, "link"),
                textOrNull(organic, "snippet"),
                SOURCE_NAME,
                searchTerm,
                policy.name(),
                EXTRACTION_METHOD,
                city,
                null,
                null,
                foundAt
            ));
        }
        return leads;
    }

    static String buildUrl(String baseUrl, Map<String, String> params) {
        StringBuilder url = new StringBuilder(baseUrl);
        char separator = baseUrl.contains("?") ? '&' : '?';
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            url.append(separator)
                .append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
            separator = '&';
        }
        return url.toString();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
