package com.ekslens.leadmaster.lead.model;

import java.time.Instant;

public record JobLogEntry(Instant timestamp, String level, String message) {
    public static final String INFO = "INFO";
    public static final String SUCCESS = "SUCCESS";
    public static final String WARNING = "WARNING";
    public static final String ERROR = "ERROR";
}
