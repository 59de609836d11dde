package com.ekslens.leadmaster.lead.collector;

import com.ekslens.leadmaster.lead.model.CollectorResult;

/**
 * One external lead source. {@link #search} must not throw: network, parsing and automation
 * errors are absorbed and reported as failed attempts with no leads.
 */
public interface SourceCollector {

    /** Lower-case key used in request source flags, e.g. {@code serpapi}. */
    String key();

    /** Value stored as a lead's source. */
    String sourceName();

    /** Collectors run in ascending priority order. */
    int priority();

    /** Whether the credentials and drivers this source needs are configured. */
    boolean available();

    CollectorResult search(CollectorQuery query);
}
