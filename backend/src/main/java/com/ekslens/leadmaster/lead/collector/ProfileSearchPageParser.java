package com.ekslens.leadmaster.lead.collector;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts profile cards from a rendered people-search results page. Only links that point at a
 * member profile count; connection hints and company pages are ignored.
 */
@Component
public class ProfileSearchPageParser {
    private static final Pattern PROFILE_URL = Pattern.compile("https://www\\.linkedin\\.com/in/[^/?#]+/?(\\?.*)?$");
    private static final List<String> CONTAINER_SELECTORS = List.of(
        ".reusable-search__result-container",
        "[data-chameleon-result-urn]",
        ".entity-result"
    );
    private static final List<String> NON_NAME_WORDS = List.of("ver", "view", "perfil", "profile", "conectar", "connect");
    private static final int MIN_NAME_LENGTH = 2;

    public List<ProfileCard> parse(String html, String baseUri, int maxResults) {
        if (html == null || html.isBlank() || maxResults <= 0) {
            return List.of();
        }
        Document document = Jsoup.parse(html, baseUri == null ? "" : baseUri);
        List<Element> containers = new ArrayList<>();
        for (String selector : CONTAINER_SELECTORS) {
            Elements found = document.select(selector);
            if (!found.isEmpty()) {
                containers.addAll(found);
                break;
            }
        }
        if (containers.isEmpty()) {
            containers.addAll(document.select("a[href]"));
        }

        List<ProfileCard> cards = new ArrayList<>();
        Set<String> seenUrls = new HashSet<>();
        for (Element container : containers) {
            if (cards.size() >= maxResults) {
                break;
            }
            Element link = firstProfileLink(container);
            if (link == null) {
                continue;
            }
            String name = extractName(link);
            if (name == null) {
                continue;
            }
            String url = canonicalProfileUrl(link.absUrl("href"));
            if (!seenUrls.add(url.toLowerCase(Locale.ROOT))) {
                continue;
            }
            cards.add(new ProfileCard(
                name,
                url,
                firstText(container, "[class*=primary-subtitle]"),
                firstText(container, "[class*=secondary-subtitle], [class*=location]")
            ));
        }
        return cards;
    }

    static boolean isProfileUrl(String href) {
        return href != null && PROFILE_URL.matcher(href).matches();
    }

    static String canonicalProfileUrl(String href) {
        int query = href.indexOf('?');
        String url = query >= 0 ? href.substring(0, query) : href;
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private Element firstProfileLink(Element container) {
        if (container.is("a[href]")) {
            return isProfileUrl(container.absUrl("href")) ? container : null;
        }
        for (Element link : container.select("a[href]")) {
            if (isProfileUrl(link.absUrl("href"))) {
                return link;
            }
        }
        return null;
    }

    private String extractName(Element link) {
        for (Element span : link.select("span[aria-hidden=true]")) {
            String text = span.text().trim();
            if (looksLikeName(text)) {
                return text;
            }
        }
        String text = link.ownText().trim();
        if (looksLikeName(text)) {
            return text;
        }
        text = link.text().trim();
        return looksLikeName(text) ? text : null;
    }

    private boolean looksLikeName(String text) {
        if (text == null || text.length() < MIN_NAME_LENGTH) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String word : NON_NAME_WORDS) {
            if (lower.equals(word) || lower.startsWith(word + " ")) {
                return false;
            }
        }
        return true;
    }

    private String firstText(Element container, String selector) {
        Element element = container.selectFirst(selector);
        if (element == null) {
            return null;
        }
        String text = element.text().trim();
        return text.isEmpty() ? null : text;
    }
}
