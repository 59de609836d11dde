package com.ekslens.leadmaster.lead.model;

import java.time.Instant;

public record DraftedMessage(Long leadId, String leadName, String content, String industry, Instant generatedAt) {
}
