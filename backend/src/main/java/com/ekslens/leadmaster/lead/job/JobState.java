package com.ekslens.leadmaster.lead.job;

import com.ekslens.leadmaster.config.LeadMasterProperties;
import com.ekslens.leadmaster.lead.model.JobLifecycle;
import com.ekslens.leadmaster.lead.model.JobLogEntry;
import com.ekslens.leadmaster.lead.model.JobStateSnapshot;
import com.ekslens.leadmaster.lead.model.SessionReport;
import com.ekslens.leadmaster.lead.model.SessionStatsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Process-wide state of the single aggregation job. Written by the run's worker thread and read
 * by status pollers; every access goes through one lock so readers always see a consistent
 * snapshot. Nothing here survives a restart.
 */
@Component
public class JobState {
    private static final Logger log = LoggerFactory.getLogger(JobState.class);
    static final String IDLE_MESSAGE = "Idle";

    private final Object lock = new Object();
    private final BoundedLog<JobLogEntry> entries;

    private JobLifecycle lifecycle = JobLifecycle.IDLE;
    private boolean running;
    private int progress;
    private String statusMessage = IDLE_MESSAGE;
    private boolean stopRequested;
    private SessionStatsSnapshot sessionStats;
    private SessionReport lastResults;

    public JobState(LeadMasterProperties properties) {
        this.entries = new BoundedLog<>(properties.getLogCapacity());
    }

    /**
     * Atomically claims the job slot. Returns {@code false}, touching nothing, when a run is
     * already active.
     */
    public boolean tryStart(String message) {
        synchronized (lock) {
            if (running) {
                return false;
            }
            running = true;
            lifecycle = JobLifecycle.RUNNING;
            progress = 0;
            stopRequested = false;
            sessionStats = null;
            statusMessage = message;
            append(JobLogEntry.INFO, message);
            return true;
        }
    }

    /** Raises progress; lower values than the current one are ignored within a run. */
    public void updateProgress(int percent, String message) {
        synchronized (lock) {
            if (!running) {
                return;
            }
            progress = Math.max(progress, Math.min(100, Math.max(0, percent)));
            if (message != null) {
                statusMessage = message;
            }
        }
    }

    public void updateStatus(String message) {
        synchronized (lock) {
            if (running && message != null) {
                statusMessage = message;
            }
        }
    }

    public void publishStats(SessionStatsSnapshot stats) {
        synchronized (lock) {
            if (running) {
                sessionStats = stats;
            }
        }
    }

    public boolean requestStop() {
        synchronized (lock) {
            if (!running) {
                return false;
            }
            if (!stopRequested) {
                stopRequested = true;
                statusMessage = "Stop requested";
                append(JobLogEntry.WARNING, "Stop requested, finishing current step");
            }
            return true;
        }
    }

    public boolean isStopRequested() {
        synchronized (lock) {
            return stopRequested;
        }
    }

    public void complete(SessionReport report, String message) {
        synchronized (lock) {
            running = false;
            stopRequested = false;
            lifecycle = JobLifecycle.COMPLETED;
            progress = 100;
            statusMessage = message;
            sessionStats = report.stats();
            lastResults = report;
            append(JobLogEntry.SUCCESS, message);
        }
    }

    public void cancel(SessionReport partialReport, String message) {
        synchronized (lock) {
            running = false;
            stopRequested = false;
            lifecycle = JobLifecycle.CANCELLED;
            statusMessage = message;
            if (partialReport != null) {
                sessionStats = partialReport.stats();
                lastResults = partialReport;
            }
            append(JobLogEntry.WARNING, message);
        }
    }

    /** Ends the run as failed. The previous {@code lastResults} is kept. */
    public void fail(String errorMessage) {
        synchronized (lock) {
            running = false;
            stopRequested = false;
            lifecycle = JobLifecycle.FAILED;
            progress = 0;
            statusMessage = errorMessage;
            append(JobLogEntry.ERROR, errorMessage);
        }
    }

    public void info(String message) {
        record(JobLogEntry.INFO, message);
    }

    public void success(String message) {
        record(JobLogEntry.SUCCESS, message);
    }

    public void warning(String message) {
        record(JobLogEntry.WARNING, message);
    }

    public void error(String message) {
        record(JobLogEntry.ERROR, message);
    }

    public JobStateSnapshot snapshot() {
        synchronized (lock) {
            return new JobStateSnapshot(lifecycle, running, progress, statusMessage, stopRequested, sessionStats);
        }
    }

    public List<JobLogEntry> logs() {
        synchronized (lock) {
            return entries.snapshot();
        }
    }

    public Optional<SessionReport> lastResults() {
        synchronized (lock) {
            return Optional.ofNullable(lastResults);
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }

    private void record(String level, String message) {
        synchronized (lock) {
            append(level, message);
        }
    }

    private void append(String level, String message) {
        entries.append(new JobLogEntry(Instant.now(), level, message));
        if (JobLogEntry.ERROR.equals(level)) {
            log.error("{}", message);
        } else if (JobLogEntry.WARNING.equals(level)) {
            log.warn("{}", message);
        } else {
            log.info("{}", message);
        }
    }
}
