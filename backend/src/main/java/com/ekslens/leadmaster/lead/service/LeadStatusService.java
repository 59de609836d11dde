package com.ekslens.leadmaster.lead.service;

import com.ekslens.leadmaster.lead.job.JobState;
import com.ekslens.leadmaster.lead.model.JobLogsResponse;
import com.ekslens.leadmaster.lead.model.JobStateSnapshot;
import com.ekslens.leadmaster.lead.model.JobStatusResponse;
import com.ekslens.leadmaster.lead.model.SessionReport;
import com.ekslens.leadmaster.lead.model.SessionStatsSnapshot;
import com.ekslens.leadmaster.lead.persistence.LeadStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Service
public class LeadStatusService {
    private static final Logger log = LoggerFactory.getLogger(LeadStatusService.class);

    private final JobState jobState;
    private final LeadStore store;
    private final LeadAggregationService aggregationService;

    public LeadStatusService(JobState jobState, LeadStore store, LeadAggregationService aggregationService) {
        this.jobState = jobState;
        this.store = store;
        this.aggregationService = aggregationService;
    }

    public JobStatusResponse getStatus() {
        JobStateSnapshot snapshot = jobState.snapshot();
        Map<String, Long> counts = new LinkedHashMap<>();
        boolean dbConnected = store.isReachable();
        if (dbConnected) {
            try {
                counts.put("total_leads", store.countLeads());
                counts.put("total_messages", store.countMessages());
            } catch (DataAccessException e) {
                log.warn("Failed to load lead counts", e);
            }
        }
        SessionStatsSnapshot session = snapshot.sessionStats();
        if (session != null) {
            counts.put("session_searches", (long) session.searchesPerformed());
            counts.put("session_leads_found", (long) session.leadsFound());
            counts.put("session_leads_saved", (long) session.leadsSaved());
            counts.put("session_messages", (long) session.messagesDrafted());
        }
        return new JobStatusResponse(
            snapshot.running(),
            snapshot.lifecycle(),
            snapshot.progress(),
            snapshot.statusMessage(),
            aggregationService.currentIndustry().name(),
            dbConnected,
            counts
        );
    }

    public JobLogsResponse getLogs() {
        JobStateSnapshot snapshot = jobState.snapshot();
        return new JobLogsResponse(jobState.logs(), snapshot.running(), snapshot.progress(), snapshot.statusMessage());
    }

    public Optional<SessionReport> getLastResults() {
        return jobState.lastResults();
    }
}
