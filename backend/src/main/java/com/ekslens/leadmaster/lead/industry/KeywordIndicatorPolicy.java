package com.ekslens.leadmaster.lead.industry;

import com.ekslens.leadmaster.lead.model.Lead;
import com.ekslens.leadmaster.lead.model.OutreachContext;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public abstract class KeywordIndicatorPolicy implements IndustryPolicy {

    @Override
    public boolean validate(Lead candidate) {
        if (candidate == null) {
            return false;
        }
        String text = combinedText(candidate);
        int positive = countHits(text, companyIndicators());
        int negative = countHits(text, negativeIndicators());
        return positive > negative && positive >= 1;
    }

    @Override
    public Map<String, String> buildSearchParams(String keyword, String city) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", safe(keyword) + " " + safe(city));
        params.put("location", safe(city));
        params.put("hl", "es");
        params.put("gl", "es");
        params.put("google_domain", "google.es");
        customizeSearchParams(params, safe(keyword), safe(city));
        return params;
    }

    protected void customizeSearchParams(Map<String, String> params, String keyword, String city) {
    }

    @Override
    public List<String> keywordVariations(String keyword, String city) {
        return List.of();
    }

    @Override
    public String profileSearchUrl(String baseUrl, String term, int pageOffset) {
        String encoded = URLEncoder.encode(safe(term), StandardCharsets.UTF_8).replace("+", "%20");
        return baseUrl
            + "?keywords=" + encoded
            + "&origin=GLOBAL_SEARCH_HEADER"
            + "&start=" + Math.max(0, pageOffset);
    }

    @Override
    public OutreachContext buildOutreachContext(Lead lead) {
        return new OutreachContext(
            outreachIndustry(),
            outreachProducts(),
            outreachServices(),
            outreachAudience(),
            outreachValueProposition(),
            outreachTone(),
            lead == null ? null : lead.displayName(),
            lead == null ? null : lead.description()
        );
    }

    protected abstract String outreachIndustry();

    protected abstract List<String> outreachProducts();

    protected abstract List<String> outreachServices();

    protected abstract String outreachAudience();

    protected abstract String outreachValueProposition();

    protected String outreachTone() {
        return "profesional pero accesible";
    }

    static String combinedText(Lead candidate) {
        return (safe(candidate.displayName()) + " " + safe(candidate.description()) + " " + safe(candidate.canonicalUrl()))
            .toLowerCase(Locale.ROOT);
    }

    static int countHits(String text, List<String> indicators) {
        int hits = 0;
        for (String indicator : indicators) {
            if (indicator != null && !indicator.isBlank() && text.contains(indicator.toLowerCase(Locale.ROOT))) {
                hits++;
            }
        }
        return hits;
    }

    private static String safe(String value) {
        return value == null ? "" : value.trim();
    }
}
