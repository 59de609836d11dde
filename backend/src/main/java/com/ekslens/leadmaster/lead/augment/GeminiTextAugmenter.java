package com.ekslens.leadmaster.lead.augment;

import com.ekslens.leadmaster.config.LeadMasterProperties;
import com.ekslens.leadmaster.lead.http.RateLimitedHttpClient;
import com.ekslens.leadmaster.lead.model.HttpFetchResult;
import com.ekslens.leadmaster.lead.model.OutreachContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Drafts outreach text with the Gemini {@code generateContent} REST endpoint.
 */
@Component
public class GeminiTextAugmenter implements TextAugmenter {
    private final LeadMasterProperties properties;
    private final RateLimitedHttpClient httpClient;
    private final OutreachPromptBuilder promptBuilder;
    private final ObjectMapper objectMapper;

    public GeminiTextAugmenter(
        LeadMasterProperties properties,
        RateLimitedHttpClient httpClient,
        OutreachPromptBuilder promptBuilder,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.promptBuilder = promptBuilder;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isConfigured() {
        return properties.getAugment().isConfigured();
    }

    @Override
    public String draft(OutreachContext context) {
        if (!isConfigured()) {
            throw new TextAugmentationException("Text augmentation is not configured");
        }
        LeadMasterProperties.Augment config = properties.getAugment();
        String url = trimTrailingSlash(config.getBaseUrl())
            + "/models/" + config.getModel() + ":generateContent?key="
            + URLEncoder.encode(config.getApiKey(), StandardCharsets.UTF_8);

        HttpFetchResult result = httpClient.postJson(
            url,
            requestBody(promptBuilder.build(context)),
            Duration.ZERO,
            Duration.ofSeconds(config.getTimeoutSeconds())
        );
        if (!result.isSuccessful() || result.body() == null) {
            throw new TextAugmentationException("Draft request failed: " + result.describeFailure());
        }
        return extractText(result.body());
    }

    private String requestBody(String prompt) {
        ObjectNode root = objectMapper.createObjectNode();
        root.putArray("contents")
            .addObject()
            .putArray("parts")
            .addObject()
            .put("text", prompt);
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new TextAugmentationException("Could not encode draft request", e);
        }
    }

    private String extractText(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TextAugmentationException("Draft response is not valid JSON", e);
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : root.path("candidates").path(0).path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }
        String draft = text.toString().trim();
        if (draft.isEmpty()) {
            throw new TextAugmentationException("Draft response contained no text");
        }
        return draft;
    }

    private static String trimTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
