package com.ekslens.leadmaster.lead.model;

public record JobStateSnapshot(
    JobLifecycle lifecycle,
    boolean running,
    int progress,
    String statusMessage,
    boolean stopRequested,
    SessionStatsSnapshot sessionStats
) {
}
