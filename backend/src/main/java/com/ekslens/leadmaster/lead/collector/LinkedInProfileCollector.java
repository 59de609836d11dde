package com.ekslens.leadmaster.lead.collector;

import com.ekslens.leadmaster.config.LeadMasterProperties;
import com.ekslens.leadmaster.lead.industry.IndustryPolicy;
import com.ekslens.leadmaster.lead.model.CollectorResult;
import com.ekslens.leadmaster.lead.model.Lead;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * People search on LinkedIn through an authenticated browser session. Each search term counts
 * as one unit of the run budget; result pages are walked until one comes back empty.
 */
@Component
public class LinkedInProfileCollector implements SourceCollector {
    private static final Logger log = LoggerFactory.getLogger(LinkedInProfileCollector.class);

    public static final String KEY = "linkedin";
    public static final String SOURCE_NAME = "LinkedIn";
    static final String EXTRACTION_METHOD = "profile-search";
    static final int PAGE_SIZE = 10;
    private static final int KEYWORDS_PER_CITY = 3;
    private static final int MIN_BARE_KEYWORD_LENGTH = 5;
    private static final int MAX_VARIATIONS = 2;

    private final LeadMasterProperties properties;
    private final BrowserSessionFactory sessionFactory;
    private final ProfileSearchPageParser pageParser;

    public LinkedInProfileCollector(
        LeadMasterProperties properties,
        BrowserSessionFactory sessionFactory,
        ProfileSearchPageParser pageParser
    ) {
        this.properties = properties;
        this.sessionFactory = sessionFactory;
        this.pageParser = pageParser;
    }

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public String sourceName() {
        return SOURCE_NAME;
    }

    @Override
    public int priority() {
        return 20;
    }

    @Override
    public boolean available() {
        return properties.getLinkedin().isConfigured();
    }

    @Override
    public CollectorResult search(CollectorQuery query) {
        if (!available() || query == null || query.policy() == null) {
            return CollectorResult.empty();
        }
        LeadMasterProperties.LinkedIn config = properties.getLinkedin();
        List<Lead> leads = new ArrayList<>();
        Set<String> usedTerms = new HashSet<>();
        int searches = 0;
        int failures = 0;

        try (BrowserSession session = sessionFactory.open()) {
            if (!session.login(config.getLoginUrl(), config.getEmail(), config.getPassword())) {
                log.warn("LinkedIn login failed, skipping profile search");
                return new CollectorResult(List.of(), 0, 1);
            }
            List<String> cities = query.cities().subList(0, Math.min(config.getMaxCities(), query.cities().size()));
            outer:
            for (String city : cities) {
                for (String term : buildSearchTerms(query.policy(), city, query.keywords())) {
                    if (searches >= query.budget() || query.isStopRequested()) {
                        break outer;
                    }
                    String termKey = (city + "_" + term).toLowerCase(Locale.ROOT);
                    if (!usedTerms.add(termKey)) {
                        continue;
                    }
                    searches++;
                    PageWalk walk = walkPages(session, query, term, city);
                    leads.addAll(walk.leads());
                    failures += walk.failures();
                    if (walk.interrupted()) {
                        break outer;
                    }
                }
            }
        } catch (RuntimeException e) {
            failures++;
            log.warn("LinkedIn profile search aborted", e);
        }
        List<Lead> unique = removeDuplicates(leads);
        log.info("LinkedIn collected {} unique profiles from {} searches ({} failed)", unique.size(), searches, failures);
        return new CollectorResult(unique, searches, failures);
    }

    List<String> buildSearchTerms(IndustryPolicy policy, String city, List<String> keywords) {
        LinkedHashSet<String> terms = new LinkedHashSet<>();
        String place = city == null ? "" : city.trim();
        for (String raw : keywords.subList(0, Math.min(KEYWORDS_PER_CITY, keywords.size()))) {
            String keyword = raw == null ? "" : raw.trim();
            if (keyword.isEmpty()) {
                continue;
            }
            terms.add((keyword + " " + place).trim());
            if (keyword.length() >= MIN_BARE_KEYWORD_LENGTH) {
                terms.add(keyword);
            }
            List<String> variations = policy.keywordVariations(keyword, place);
            terms.addAll(variations.subList(0, Math.min(MAX_VARIATIONS, variations.size())));
        }
        List<String> ordered = new ArrayList<>(terms);
        return ordered.subList(0, Math.min(properties.getLinkedin().getMaxTermsPerCity(), ordered.size()));
    }

    private PageWalk walkPages(BrowserSession session, CollectorQuery query, String term, String city) {
        LeadMasterProperties.LinkedIn config = properties.getLinkedin();
        List<Lead> leads = new ArrayList<>();
        int failures = 0;
        for (int page = 0; page < config.getPagesPerTerm(); page++) {
            if (query.isStopRequested()) {
                return new PageWalk(leads, failures, true);
            }
            String url = query.policy().profileSearchUrl(config.getSearchUrl(), term, page * PAGE_SIZE);
            List<ProfileCard> cards;
            try {
                cards = pageParser.parse(session.loadPage(url), url, config.getResultsPerPage());
            } catch (RuntimeException e) {
                failures++;
                log.warn("LinkedIn page {} for '{}' failed: {}", page + 1, term, e.getMessage());
                break;
            }
            if (cards.isEmpty()) {
                break;
            }
            Instant foundAt = Instant.now();
            for (ProfileCard card : cards) {
                leads.add(toLead(card, term, city, query.policy(), foundAt));
            }
            if (!pause(config.getDelayMs())) {
                return new PageWalk(leads, failures, true);
            }
        }
        return new PageWalk(leads, failures, false);
    }

    private Lead toLead(ProfileCard card, String term, String city, IndustryPolicy policy, Instant foundAt) {
        String description = joinNonBlank(card.headline(), card.location());
        return new Lead(
            card.name(),
            card.profileUrl(),
            description,
            SOURCE_NAME,
            term,
            policy.name(),
            EXTRACTION_METHOD,
            card.location() == null ? city : card.location(),
            null,
            null,
            foundAt
        );
    }

    static List<Lead> removeDuplicates(List<Lead> leads) {
        Set<String> seenNames = new HashSet<>();
        Set<String> seenUrls = new HashSet<>();
        List<Lead> unique = new ArrayList<>();
        for (Lead lead : leads) {
            String nameKey = lead.displayName() == null ? "" : lead.displayName().trim().toLowerCase(Locale.ROOT);
            String urlKey = lead.canonicalUrl() == null ? "" : lead.canonicalUrl().trim().toLowerCase(Locale.ROOT);
            if (seenNames.contains(nameKey) || (!urlKey.isEmpty() && seenUrls.contains(urlKey))) {
                continue;
            }
            seenNames.add(nameKey);
            if (!urlKey.isEmpty()) {
                seenUrls.add(urlKey);
            }
            unique.add(lead);
        }
        return unique;
    }

    private static String joinNonBlank(String first, String second) {
        boolean hasFirst = first != null && !first.isBlank();
        boolean hasSecond = second != null && !second.isBlank();
        if (hasFirst && hasSecond) {
            return first.trim() + " | " + second.trim();
        }
        if (hasFirst) {
            return first.trim();
        }
        return hasSecond ? second.trim() : null;
    }

    private static boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private record PageWalk(List<Lead> leads, int failures, boolean interrupted) {
    }
}
