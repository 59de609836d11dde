package com.ekslens.leadmaster.lead.model;

public record StartSearchResponse(boolean accepted, String reason, String message) {
    public static StartSearchResponse accepted(String message) {
        return new StartSearchResponse(true, null, message);
    }

    public static StartSearchResponse rejected(String reason, String message) {
        return new StartSearchResponse(false, reason, message);
    }
}
