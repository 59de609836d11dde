package com.ekslens.leadmaster.lead.service;

import com.ekslens.leadmaster.config.LeadMasterProperties;
import com.ekslens.leadmaster.lead.augment.TextAugmentationException;
import com.ekslens.leadmaster.lead.augment.TextAugmenter;
import com.ekslens.leadmaster.lead.collector.CollectorQuery;
import com.ekslens.leadmaster.lead.collector.SourceCollector;
import com.ekslens.leadmaster.lead.collector.SourceCollectorRegistry;
import com.ekslens.leadmaster.lead.dedup.DedupOutcome;
import com.ekslens.leadmaster.lead.dedup.LeadBatch;
import com.ekslens.leadmaster.lead.dedup.LeadDeduplicator;
import com.ekslens.leadmaster.lead.industry.IndustryPolicy;
import com.ekslens.leadmaster.lead.industry.IndustryPolicyRegistry;
import com.ekslens.leadmaster.lead.job.JobState;
import com.ekslens.leadmaster.lead.model.CollectorResult;
import com.ekslens.leadmaster.lead.model.DraftedMessage;
import com.ekslens.leadmaster.lead.model.JobLifecycle;
import com.ekslens.leadmaster.lead.model.Lead;
import com.ekslens.leadmaster.lead.model.LeadIdentity;
import com.ekslens.leadmaster.lead.model.LeadInsertResult;
import com.ekslens.leadmaster.lead.model.LeadSample;
import com.ekslens.leadmaster.lead.model.LeadStatus;
import com.ekslens.leadmaster.lead.model.PhaseStatus;
import com.ekslens.leadmaster.lead.model.PhaseSummary;
import com.ekslens.leadmaster.lead.model.SearchRequest;
import com.ekslens.leadmaster.lead.model.SessionReport;
import com.ekslens.leadmaster.lead.model.SessionStats;
import com.ekslens.leadmaster.lead.model.StartSearchResponse;
import com.ekslens.leadmaster.lead.persistence.LeadPersistenceException;
import com.ekslens.leadmaster.lead.persistence.LeadStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one lead search session: collectors in priority order, validation and deduplication of
 * every candidate, persistence, then drafting for a small sample of new leads.
 *
 * <p>The stop flag is read before each collector phase, inside collectors between searches and
 * result pages, before each candidate is persisted, and before the drafting phase and each
 * draft.
 */
@Service
public class LeadAggregationService {
    private static final Logger log = LoggerFactory.getLogger(LeadAggregationService.class);

    static final int PROGRESS_SETUP = 10;
    static final int PROGRESS_COLLECTED = 80;
    static final int PROGRESS_DRAFTED = 95;
    static final String AUGMENT_PHASE = "augment";
    private static final int SAMPLE_SIZE = 5;
    private static final int SAMPLE_DESCRIPTION_LENGTH = 100;

    private final LeadMasterProperties properties;
    private final IndustryPolicyRegistry industryRegistry;
    private final SourceCollectorRegistry collectorRegistry;
    private final LeadDeduplicator deduplicator;
    private final LeadStore store;
    private final TextAugmenter augmenter;
    private final JobState jobState;
    private final SessionReportWriter reportWriter;
    private final ExecutorService leadRunExecutor;
    private final AtomicReference<IndustryPolicy> currentIndustry;

    public LeadAggregationService(
        LeadMasterProperties properties,
        IndustryPolicyRegistry industryRegistry,
        SourceCollectorRegistry collectorRegistry,
        LeadDeduplicator deduplicator,
        LeadStore store,
        TextAugmenter augmenter,
        JobState jobState,
        SessionReportWriter reportWriter,
        @Qualifier("leadRunExecutor") ExecutorService leadRunExecutor
    ) {
        this.properties = properties;
        this.industryRegistry = industryRegistry;
        this.collectorRegistry = collectorRegistry;
        this.deduplicator = deduplicator;
        this.store = store;
        this.augmenter = augmenter;
        this.jobState = jobState;
        this.reportWriter = reportWriter;
        this.leadRunExecutor = leadRunExecutor;
        this.currentIndustry = new AtomicReference<>(industryRegistry.defaultPolicy());
    }

    public IndustryPolicy currentIndustry() {
        return currentIndustry.get();
    }

    /**
     * Switches the industry used by later runs. A run already in progress keeps the policy it
     * started with.
     */
    public IndustryPolicy changeIndustry(String industryId) {
        IndustryPolicy policy = industryRegistry.resolve(industryId);
        IndustryPolicy previous = currentIndustry.getAndSet(policy);
        if (previous != policy) {
            jobState.info("Industry changed to " + policy.name());
        }
        return policy;
    }

    public SessionReport run(SearchRequest request) {
        IndustryPolicy policy = claim(request);
        return execute(policy, request);
    }

    public StartSearchResponse startAsync(SearchRequest request) {
        IndustryPolicy policy = claim(request);
        try {
            leadRunExecutor.submit(() -> execute(policy, request));
        } catch (RejectedExecutionException e) {
            jobState.fail("Search could not be scheduled: " + e.getMessage());
            throw e;
        }
        return StartSearchResponse.accepted("Search started for " + policy.name());
    }

    public boolean stop() {
        return jobState.requestStop();
    }

    private IndustryPolicy claim(SearchRequest request) {
        IndustryPolicy policy = request.industryId() == null
            ? currentIndustry.get()
            : industryRegistry.resolve(request.industryId());
        if (!jobState.tryStart("Starting " + policy.name() + " search")) {
            throw new ActiveLeadRunException("A lead search is already running");
        }
        return policy;
    }

    SessionReport execute(IndustryPolicy policy, SearchRequest request) {
        Instant startedAt = Instant.now();
        RunContext run = new RunContext(policy, request, new SessionStats(policy.name(), startedAt), startedAt);
        try {
            jobState.updateProgress(PROGRESS_SETUP, "Industry " + policy.name() + " selected");
            jobState.info(
                "Industry " + policy.name() + ": " + request.cities().size() + " cities, "
                    + request.keywords().size() + " keywords, budget " + request.maxSearches()
            );

            boolean cancelled = collect(run);
            if (!cancelled) {
                cancelled = jobState.isStopRequested();
            }
            if (!cancelled) {
                PhaseSummary drafting = draftMessages(run);
                run.phases.add(drafting);
                cancelled = drafting.status() == PhaseStatus.CANCELLED;
            }

            if (cancelled) {
                SessionReport partial = buildReport(run, JobLifecycle.CANCELLED);
                jobState.cancel(partial, "Search cancelled, " + run.stats.leadsSaved() + " new leads kept");
                return partial;
            }

            SessionReport report = buildReport(run, JobLifecycle.COMPLETED);
            persistSession(report);
            jobState.complete(
                report,
                "Search completed: " + report.stats().leadsSaved() + " new leads, "
                    + report.stats().messagesDrafted() + " drafts"
            );
            return report;
        } catch (RuntimeException e) {
            log.warn("Lead search for {} failed", policy.id(), e);
            jobState.fail("Search failed: " + e.getMessage());
            return buildReport(run, JobLifecycle.FAILED);
        } catch (Error e) {
            log.error("Lead search for {} aborted", policy.id(), e);
            jobState.fail("Search aborted: " + e);
            throw e;
        }
    }

    private boolean collect(RunContext run) {
        List<SourceCollector> collectors = collectorRegistry.ordered();
        int span = PROGRESS_COLLECTED - PROGRESS_SETUP;
        for (int i = 0; i < collectors.size(); i++) {
            if (jobState.isStopRequested()) {
                return true;
            }
            SourceCollector collector = collectors.get(i);
            PhaseSummary summary = collectFrom(collector, run);
            run.phases.add(summary);
            jobState.publishStats(run.stats.snapshot(Instant.now()));
            jobState.updateProgress(
                PROGRESS_SETUP + (span * (i + 1)) / collectors.size(),
                collector.sourceName() + " done"
            );
            if (summary.status() == PhaseStatus.CANCELLED) {
                return true;
            }
        }
        jobState.updateProgress(PROGRESS_COLLECTED, "Collection finished");
        return false;
    }

    private PhaseSummary collectFrom(SourceCollector collector, RunContext run) {
        String phase = "collect:" + collector.key();
        String source = collector.sourceName();
        if (!run.request.isSourceEnabled(collector.key())) {
            jobState.info(source + " disabled for this search, skipping");
            return PhaseSummary.skipped(phase, source, "disabled");
        }
        if (!collector.available()) {
            jobState.info(source + " not configured, skipping");
            return PhaseSummary.skipped(phase, source, "not_configured");
        }

        jobState.info("Searching " + source);
        jobState.updateStatus("Searching " + source);
        CollectorResult result;
        try {
            result = collector.search(new CollectorQuery(
                run.policy,
                run.request.cities(),
                run.request.keywords(),
                run.request.maxSearches(),
                jobState::isStopRequested
            ));
        } catch (RuntimeException e) {
            log.warn("Collector {} failed", collector.key(), e);
            jobState.warning(source + " failed: " + e.getMessage());
            return new PhaseSummary(phase, source, PhaseStatus.FAILED, 0, 0, 0, 0, 0, 1, e.getMessage());
        }

        run.stats.addSearches(result.searchesPerformed());
        run.stats.addFound(result.leads().size());
        int rejected = 0;
        int duplicates = 0;
        int saved = 0;
        int failures = result.failedAttempts();
        boolean cancelled = false;
        for (Lead raw : result.leads()) {
            if (jobState.isStopRequested()) {
                cancelled = true;
                break;
            }
            switch (accept(raw.withIndustryName(run.policy.name()), run)) {
                case SAVED -> saved++;
                case DUPLICATE -> duplicates++;
                case REJECTED -> rejected++;
                case FAILED -> failures++;
            }
        }
        if (!cancelled && jobState.isStopRequested()) {
            cancelled = true;
        }
        run.leadsBySource.merge(source, saved, Integer::sum);

        PhaseStatus status = cancelled
            ? PhaseStatus.CANCELLED
            : failures > 0 ? PhaseStatus.COMPLETED_WITH_ERRORS : PhaseStatus.COMPLETED;
        String summary = source + ": " + result.leads().size() + " found, " + saved + " saved, "
            + duplicates + " duplicates, " + rejected + " rejected";
        if (failures > 0) {
            jobState.warning(summary + ", " + failures + " failed");
        } else {
            jobState.success(summary);
        }
        return new PhaseSummary(
            phase,
            source,
            status,
            result.searchesPerformed(),
            result.leads().size(),
            rejected,
            duplicates,
            saved,
            failures,
            null
        );
    }

    private CandidateOutcome accept(Lead candidate, RunContext run) {
        if (!candidate.hasDisplayName() || !run.policy.validate(candidate)) {
            run.stats.incrementRejected();
            return CandidateOutcome.REJECTED;
        }
        LeadIdentity identity = LeadIdentity.of(candidate);
        try {
            DedupOutcome dedup = deduplicator.check(candidate, run.batch);
            if (dedup.isDuplicate()) {
                if (dedup.existingId() != null) {
                    run.batch.register(identity, dedup.existingId());
                }
                run.stats.incrementDuplicates();
                return CandidateOutcome.DUPLICATE;
            }
            LeadInsertResult inserted = store.insert(candidate, LeadStatus.PENDING);
            run.batch.register(identity, inserted.id());
            if (!inserted.created()) {
                run.stats.incrementDuplicates();
                return CandidateOutcome.DUPLICATE;
            }
            run.stats.incrementSaved();
            run.saved.add(new SavedLead(inserted.id(), candidate));
            return CandidateOutcome.SAVED;
        } catch (LeadPersistenceException | DataAccessException e) {
            log.warn("Dropping lead '{}' after store failure", candidate.displayName(), e);
            jobState.warning("Could not save " + candidate.displayName() + ": " + e.getMessage());
            return CandidateOutcome.FAILED;
        }
    }

    private PhaseSummary draftMessages(RunContext run) {
        if (!augmenter.isConfigured()) {
            jobState.info("Text augmentation not configured, skipping drafts");
            return PhaseSummary.skipped(AUGMENT_PHASE, AUGMENT_PHASE, "not_configured");
        }
        if (run.saved.isEmpty()) {
            jobState.info("No new leads to draft messages for");
            return PhaseSummary.skipped(AUGMENT_PHASE, AUGMENT_PHASE, "no_new_leads");
        }
        List<SavedLead> sample = run.saved.subList(0, Math.min(properties.getAugment().getSampleSize(), run.saved.size()));
        jobState.info("Drafting messages for " + sample.size() + " leads");
        int drafted = 0;
        int failures = 0;
        boolean cancelled = false;
        int span = PROGRESS_DRAFTED - PROGRESS_COLLECTED;
        for (int i = 0; i < sample.size(); i++) {
            if (jobState.isStopRequested()) {
                cancelled = true;
                break;
            }
            SavedLead target = sample.get(i);
            try {
                String content = augmenter.draft(run.policy.buildOutreachContext(target.lead()));
                DraftedMessage message = new DraftedMessage(
                    target.id(),
                    target.lead().displayName(),
                    content,
                    run.policy.name(),
                    Instant.now()
                );
                store.insertMessage(message);
                run.drafts.add(message);
                run.stats.incrementDrafted();
                drafted++;
            } catch (TextAugmentationException | LeadPersistenceException e) {
                failures++;
                log.warn("Draft for lead {} failed", target.id(), e);
                jobState.warning("Draft failed for " + target.lead().displayName() + ": " + e.getMessage());
            }
            jobState.updateProgress(PROGRESS_COLLECTED + (span * (i + 1)) / sample.size(), "Drafting messages");
        }
        jobState.publishStats(run.stats.snapshot(Instant.now()));
        PhaseStatus status = cancelled
            ? PhaseStatus.CANCELLED
            : failures > 0 ? PhaseStatus.COMPLETED_WITH_ERRORS : PhaseStatus.COMPLETED;
        jobState.info(drafted + " messages drafted");
        return new PhaseSummary(AUGMENT_PHASE, AUGMENT_PHASE, status, 0, sample.size(), 0, 0, drafted, failures, null);
    }

    private void persistSession(SessionReport report) {
        Optional<Path> written = reportWriter.write(report);
        written.ifPresent(path -> jobState.info("Session report written to " + path));
        try {
            store.recordSession(report, written.map(Path::toString).orElse(null));
        } catch (DataAccessException e) {
            log.warn("Failed to record search session for {}", report.industryId(), e);
        }
    }

    private SessionReport buildReport(RunContext run, JobLifecycle status) {
        Instant finishedAt = Instant.now();
        List<LeadSample> samples = new ArrayList<>();
        for (SavedLead saved : run.saved.subList(0, Math.min(SAMPLE_SIZE, run.saved.size()))) {
            samples.add(new LeadSample(
                saved.id(),
                saved.lead().displayName(),
                saved.lead().sourceName(),
                saved.lead().canonicalUrl(),
                truncate(saved.lead().description(), SAMPLE_DESCRIPTION_LENGTH)
            ));
        }
        return new SessionReport(
            run.policy.id(),
            run.policy.name(),
            status,
            run.startedAt,
            finishedAt,
            run.stats.snapshot(finishedAt),
            List.copyOf(run.phases),
            Collections.unmodifiableMap(new LinkedHashMap<>(run.leadsBySource)),
            samples,
            List.copyOf(run.drafts)
        );
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength) + "...";
    }

    private enum CandidateOutcome {
        SAVED,
        DUPLICATE,
        REJECTED,
        FAILED
    }

    private record SavedLead(long id, Lead lead) {
    }

    private static final class RunContext {
        private final IndustryPolicy policy;
        private final SearchRequest request;
        private final SessionStats stats;
        private final Instant startedAt;
        private final LeadBatch batch = new LeadBatch();
        private final List<PhaseSummary> phases = new ArrayList<>();
        private final Map<String, Integer> leadsBySource = new LinkedHashMap<>();
        private final List<SavedLead> saved = new ArrayList<>();
        private final List<DraftedMessage> drafts = new ArrayList<>();

        private RunContext(IndustryPolicy policy, SearchRequest request, SessionStats stats, Instant startedAt) {
            this.policy = policy;
            this.request = request;
            this.stats = stats;
            this.startedAt = startedAt;
        }
    }
}
