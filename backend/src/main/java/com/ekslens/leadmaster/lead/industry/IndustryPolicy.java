package com.ekslens.leadmaster.lead.industry;

import com.ekslens.leadmaster.lead.model.Lead;
import com.ekslens.leadmaster.lead.model.OutreachContext;

import java.util.List;
import java.util.Map;

/**
 * Vocabulary and validation rules for one target vertical. Implementations are stateless and
 * shared between runs; a run binds one policy for its whole duration.
 */
public interface IndustryPolicy {

    /** Registry key, e.g. {@code medical_aesthetics}. */
    String id();

    /** Human readable name stored on accepted leads. */
    String name();

    List<String> defaultKeywords();

    List<String> searchTerms();

    List<String> companyIndicators();

    List<String> negativeIndicators();

    /**
     * Pure predicate over the candidate's name, description and URL. A candidate is accepted only
     * when it hits more positive than negative indicators and at least one positive indicator.
     */
    boolean validate(Lead candidate);

    /** Query parameters for one organic search of {@code keyword} in {@code city}. */
    Map<String, String> buildSearchParams(String keyword, String city);

    /** Extra people-search phrasings for a keyword; may be empty. */
    List<String> keywordVariations(String keyword, String city);

    String profileSearchUrl(String baseUrl, String term, int pageOffset);

    OutreachContext buildOutreachContext(Lead lead);
}
