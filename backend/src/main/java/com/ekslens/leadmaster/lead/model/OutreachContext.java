package com.ekslens.leadmaster.lead.model;

import java.util.List;

public record OutreachContext(
    String industry,
    List<String> products,
    List<String> services,
    String targetAudience,
    String valueProposition,
    String tone,
    String leadName,
    String leadDescription
) {
}
