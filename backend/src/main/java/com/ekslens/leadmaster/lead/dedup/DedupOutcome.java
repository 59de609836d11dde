package com.ekslens.leadmaster.lead.dedup;

public record DedupOutcome(Kind kind, Long existingId) {

    public enum Kind {
        NEW,
        BATCH_DUPLICATE,
        STORED_DUPLICATE
    }

    public static DedupOutcome fresh() {
        return new DedupOutcome(Kind.NEW, null);
    }

    public static DedupOutcome inBatch(Long existingId) {
        return new DedupOutcome(Kind.BATCH_DUPLICATE, existingId);
    }

    public static DedupOutcome stored(long existingId) {
        return new DedupOutcome(Kind.STORED_DUPLICATE, existingId);
    }

    public boolean isDuplicate() {
        return kind != Kind.NEW;
    }
}
