package com.ekslens.leadmaster.lead.model;

public record ManualLeadResponse(long id, boolean created, String message) {
}
