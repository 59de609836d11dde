package com.ekslens.leadmaster.lead.model;

import java.util.Map;

public record JobStatusResponse(
    boolean running,
    JobLifecycle lifecycle,
    int progress,
    String statusMessage,
    String industry,
    boolean databaseConnected,
    Map<String, Long> counts
) {
}
