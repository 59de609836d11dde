package com.ekslens.leadmaster.lead.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Counters for one aggregation run. Confined to the run's worker thread; other threads only
 * ever see {@link SessionStatsSnapshot} copies.
 */
public class SessionStats {
    private final String industry;
    private final Instant startedAt;
    private int searchesPerformed;
    private int leadsFound;
    private int leadsSaved;
    private int duplicatesResolved;
    private int rejected;
    private int messagesDrafted;

    public SessionStats(String industry, Instant startedAt) {
        this.industry = industry;
        this.startedAt = startedAt;
    }

    public void addSearches(int count) {
        searchesPerformed += Math.max(0, count);
    }

    public void addFound(int count) {
        leadsFound += Math.max(0, count);
    }

    public void incrementSaved() {
        leadsSaved++;
    }

    public void incrementDuplicates() {
        duplicatesResolved++;
    }

    public void incrementRejected() {
        rejected++;
    }

    public void incrementDrafted() {
        messagesDrafted++;
    }

    public int leadsSaved() {
        return leadsSaved;
    }

    public SessionStatsSnapshot snapshot(Instant now) {
        double seconds = Duration.between(startedAt, now).toMillis() / 1000.0;
        return new SessionStatsSnapshot(
            industry,
            searchesPerformed,
            leadsFound,
            leadsSaved,
            duplicatesResolved,
            rejected,
            messagesDrafted,
            Math.max(0.0, seconds)
        );
    }
}
