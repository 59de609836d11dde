package com.ekslens.leadmaster.lead.model;

public record LeadSample(Long id, String name, String source, String url, String description) {
}
