package com.ekslens.leadmaster.lead.model;

import java.util.List;

public record IndustryInfo(
    String id,
    String name,
    List<String> keywords,
    List<String> searchTerms,
    List<String> companyIndicators
) {
}
