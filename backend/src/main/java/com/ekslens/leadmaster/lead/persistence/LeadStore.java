package com.ekslens.leadmaster.lead.persistence;

import com.ekslens.leadmaster.lead.model.DraftedMessage;
import com.ekslens.leadmaster.lead.model.Lead;
import com.ekslens.leadmaster.lead.model.LeadGroupField;
import com.ekslens.leadmaster.lead.model.LeadIdentity;
import com.ekslens.leadmaster.lead.model.LeadInsertResult;
import com.ekslens.leadmaster.lead.model.LeadStatus;
import com.ekslens.leadmaster.lead.model.SessionReport;
import com.ekslens.leadmaster.lead.model.StoredLead;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence boundary for leads, drafted messages and session records. A single writer at a
 * time is assumed; inserts are idempotent on the lead identity.
 */
public interface LeadStore {

    Optional<Long> findByIdentity(LeadIdentity identity);

    /**
     * Inserts the lead as {@code status}, or returns the id of the stored lead sharing its
     * identity.
     *
     * @throws LeadPersistenceException when the store rejects the row for any other reason
     */
    LeadInsertResult insert(Lead lead, LeadStatus status);

    List<StoredLead> listRecent(int limit, LeadStatus statusFilter);

    Map<String, Long> aggregateCounts(LeadGroupField field);

    long countLeads();

    long countMessages();

    long insertMessage(DraftedMessage message);

    void recordSession(SessionReport report, String reportPath);

    boolean isReachable();
}
