package com.ekslens.leadmaster.lead.service;

import com.ekslens.leadmaster.lead.dedup.DedupOutcome;
import com.ekslens.leadmaster.lead.dedup.LeadDeduplicator;
import com.ekslens.leadmaster.lead.job.JobState;
import com.ekslens.leadmaster.lead.model.Lead;
import com.ekslens.leadmaster.lead.model.LeadGroupField;
import com.ekslens.leadmaster.lead.model.LeadInsertResult;
import com.ekslens.leadmaster.lead.model.LeadStatus;
import com.ekslens.leadmaster.lead.model.LeadsOverview;
import com.ekslens.leadmaster.lead.model.ManualLeadResponse;
import com.ekslens.leadmaster.lead.persistence.LeadStore;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Service
public class LeadService {
    static final String MANUAL_SOURCE = "LinkedIn (Manual)";
    static final String MANUAL_EXTRACTION_METHOD = "manual_entry";
    private static final int RECENT_LIMIT = 10;

    private final LeadStore store;
    private final LeadDeduplicator deduplicator;
    private final LeadAggregationService aggregationService;
    private final JobState jobState;

    public LeadService(
        LeadStore store,
        LeadDeduplicator deduplicator,
        LeadAggregationService aggregationService,
        JobState jobState
    ) {
        this.store = store;
        this.deduplicator = deduplicator;
        this.aggregationService = aggregationService;
        this.jobState = jobState;
    }

    public LeadsOverview getOverview() {
        return new LeadsOverview(
            store.countLeads(),
            store.countMessages(),
            store.aggregateCounts(LeadGroupField.SOURCE),
            store.aggregateCounts(LeadGroupField.STATUS),
            store.listRecent(RECENT_LIMIT, null)
        );
    }

    public ManualLeadResponse addManualLead(
        String name,
        String website,
        String description,
        String location,
        String email,
        String phone
    ) {
        Lead lead = new Lead(
            name.trim(),
            website,
            description,
            MANUAL_SOURCE,
            null,
            aggregationService.currentIndustry().name(),
            MANUAL_EXTRACTION_METHOD,
            location,
            email,
            phone,
            Instant.now()
        );
        DedupOutcome dedup = deduplicator.check(lead, null);
        if (dedup.isDuplicate()) {
            return new ManualLeadResponse(dedup.existingId(), false, "Lead already exists");
        }
        LeadInsertResult result = store.insert(lead, LeadStatus.PENDING);
        if (result.created()) {
            jobState.success("Manual lead added: " + lead.displayName());
            return new ManualLeadResponse(result.id(), true, "Lead added");
        }
        return new ManualLeadResponse(result.id(), false, "Lead already exists");
    }
}
