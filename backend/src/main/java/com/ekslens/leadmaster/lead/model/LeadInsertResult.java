package com.ekslens.leadmaster.lead.model;

public record LeadInsertResult(long id, boolean created) {
}
