package com.ekslens.leadmaster.lead.industry;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class RealEstatePolicy extends KeywordIndicatorPolicy {
    public static final String ID = "real_estate";

    private static final List<String> DEFAULT_KEYWORDS = List.of(
        "real estate agency", "inmobiliaria", "property management",
        "real estate developer", "luxury homes", "commercial real estate",
        "property investment", "home staging", "rental management",
        "real estate broker"
    );

    private static final List<String> SEARCH_TERMS = List.of(
        "real estate agencies", "property developers", "property managers",
        "real estate investors", "luxury real estate", "commercial property",
        "holiday rentals", "construction companies", "architecture studios",
        "home staging services"
    );

    private static final List<String> COMPANY_INDICATORS = List.of(
        "real estate", "inmobiliaria", "property", "properties", "realty",
        "realtor", "homes", "housing", "apartment", "piso", "vivienda",
        "rental", "lettings", "estate agent", "broker", "developer",
        "promotora", "investment"
    );

    private static final List<String> NEGATIVE_INDICATORS = List.of(
        "university", "school", "government", "insurance",
        "newspaper", "forum", "wikipedia"
    );

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Real Estate";
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
        params.put("q", "\"" + keyword + "\" \"" + city + "\" (inmobiliaria OR \"real estate\" OR property OR agency)");
        params.put("num", "10");
    }

    @Override
    public List<String> keywordVariations(String keyword, String city) {
        if (keyword == null || keyword.isBlank()) {
            return List.of();
        }
        String place = city == null ? "" : city.trim();
        return List.of(("agente " + keyword.trim() + " " + place).trim());
    }

    @Override
    protected String outreachIndustry() {
        return "sector inmobiliario";
    }

    @Override
    protected List<String> outreachProducts() {
        return List.of("captación de propietarios", "marketing inmobiliario", "fotografía y tours virtuales");
    }

    @Override
    protected List<String> outreachServices() {
        return List.of("generación de leads", "gestión de anuncios", "asesoramiento comercial");
    }

    @Override
    protected String outreachAudience() {
        return "agencias inmobiliarias y promotoras";
    }

    @Override
    protected String outreachValueProposition() {
        return "más operaciones cerradas con menos tiempo de captación";
    }
}
