package com.ekslens.leadmaster.lead.model;

import java.util.List;

public record JobLogsResponse(List<JobLogEntry> logs, boolean running, int progress, String statusMessage) {
}
