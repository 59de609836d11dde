package com.ekslens.leadmaster.lead.industry;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Component
public class MedicalAestheticsPolicy extends KeywordIndicatorPolicy {
    public static final String ID = "medical_aesthetics";

    private static final List<String> DEFAULT_KEYWORDS = List.of(
        "botox", "dermal fillers", "hyaluronic acid",
        "restylane", "juvederm", "profhilo", "gouri",
        "aesthetic medicine", "cosmetic treatments", "anti aging",
        "facial aesthetics", "injectable treatments",
        "aesthetic clinic", "cosmetic surgery", "beauty clinic",
        "medical spa", "dermatology clinic", "plastic surgery"
    );

    private static final List<String> SEARCH_TERMS = List.of(
        "medical supplies", "healthcare equipment", "surgical instruments",
        "dental supplies", "laboratory equipment", "pharmaceutical supplies",
        "medical devices", "hospital equipment", "clinic supplies",
        "aesthetic supplies", "dermal fillers", "botox supplies",
        "medical aesthetics", "cosmetic surgery supplies", "beauty clinic equipment",
        "injection supplies", "hyaluronic acid", "aesthetic training"
    );

    private static final List<String> COMPANY_INDICATORS = List.of(
        "aesthetic", "beauty", "cosmetic", "dermal", "botox",
        "filler", "clinic", "medical spa", "anti aging",
        "skin care", "facial", "injection", "treatment",
        "restylane", "juvederm", "sculptra", "radiesse",
        "belotero", "teosyal", "profhilo", "gouri",
        "distributor", "supplier", "training", "equipment"
    );

    private static final List<String> NEGATIVE_INDICATORS = List.of(
        "hospital", "university", "school", "government",
        "insurance", "pharmacy chain", "drugstore"
    );

    // Only product names specific enough to be worth a practitioner search.
    private static final Set<String> PRACTITIONER_KEYWORDS = Set.of(
        "botox", "radiesse", "ácido hialurónico", "fillers"
    );

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Medical Aesthetics";
    }

    @Override
    public List<String> defaultKeywords() {
        return DEFAULT_KEYWORDS;
    }

    @Override
    public List<String> searchTerms() {
        return SEARCH_TERMS;
    }

    @Override
    public List<String> companyIndicators() {
        return COMPANY_INDICATORS;
    }

    @Override
    public List<String> negativeIndicators() {
        return NEGATIVE_INDICATORS;
    }

    @Override
    protected void customizeSearchParams(Map<String, String> params, String keyword, String city) {
        params.put(
            "q",
            "\"" + keyword + "\" \"" + city + "\" (clinic OR aesthetic OR beauty OR medical OR supplies OR distributor)"
        );
        params.put("num", "10");
        params.put("filter", "1");
    }

    @Override
    public List<String> keywordVariations(String keyword, String city) {
        if (keyword == null || !PRACTITIONER_KEYWORDS.contains(keyword.trim().toLowerCase(Locale.ROOT))) {
            return List.of();
        }
        String term = keyword.trim();
        String place = city == null ? "" : city.trim();
        return List.of(
            ("especialista " + term + " " + place).trim(),
            ("doctor " + term + " " + place).trim()
        );
    }

    @Override
    protected String outreachIndustry() {
        return "medicina estética";
    }

    @Override
    protected List<String> outreachProducts() {
        return List.of("fillers dérmicos", "botox", "ácido hialurónico");
    }

    @Override
    protected List<String> outreachServices() {
        return List.of("distribución", "formación", "soporte técnico");
    }

    @Override
    protected String outreachAudience() {
        return "clínicas estéticas y profesionales médicos";
    }

    @Override
    protected String outreachValueProposition() {
        return "productos premium con certificación médica";
    }
}
