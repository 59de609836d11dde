package com.ekslens.leadmaster.lead.dedup;

import com.ekslens.leadmaster.lead.model.Lead;
import com.ekslens.leadmaster.lead.model.LeadIdentity;
import com.ekslens.leadmaster.lead.persistence.LeadStore;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Two-tier duplicate check: the current run's batch first, then the store. Matching either the
 * normalized name or the normalized URL is enough.
 */
@Component
public class LeadDeduplicator {
    private final LeadStore store;

    public LeadDeduplicator(LeadStore store) {
        this.store = store;
    }

    public DedupOutcome check(Lead candidate, LeadBatch batch) {
        LeadIdentity identity = LeadIdentity.of(candidate);
        if (batch != null && batch.contains(identity)) {
            return DedupOutcome.inBatch(batch.find(identity).orElse(null));
        }
        Optional<Long> existing = store.findByIdentity(identity);
        return existing.map(DedupOutcome::stored).orElseGet(DedupOutcome::fresh);
    }

    public boolean isDuplicate(Lead candidate, LeadBatch batch) {
        return check(candidate, batch).isDuplicate();
    }
}
