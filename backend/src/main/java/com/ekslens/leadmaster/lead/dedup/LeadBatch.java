package com.ekslens.leadmaster.lead.dedup;

import com.ekslens.leadmaster.lead.model.LeadIdentity;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Identities accepted so far in one run, with the store id each resolved to. Owned by the run's
 * worker thread.
 */
public class LeadBatch {
    private final Map<String, Long> idsByName = new HashMap<>();
    private final Map<String, Long> idsByUrl = new HashMap<>();

    public Optional<Long> find(LeadIdentity identity) {
        Long byName = idsByName.get(identity.normalizedName());
        if (byName != null) {
            return Optional.of(byName);
        }
        if (identity.hasUrl()) {
            return Optional.ofNullable(idsByUrl.get(identity.normalizedUrl()));
        }
        return Optional.empty();
    }

    public boolean contains(LeadIdentity identity) {
        return idsByName.containsKey(identity.normalizedName())
            || (identity.hasUrl() && idsByUrl.containsKey(identity.normalizedUrl()));
    }

    public void register(LeadIdentity identity, long id) {
        idsByName.putIfAbsent(identity.normalizedName(), id);
        if (identity.hasUrl()) {
            idsByUrl.putIfAbsent(identity.normalizedUrl(), id);
        }
    }

    public int size() {
        return idsByName.size();
    }
}
