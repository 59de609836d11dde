package com.ekslens.leadmaster.lead.model;

import java.util.Locale;

/**
 * Identity keys of a lead. Two leads denote the same entity when their normalized names are
 * equal or when both carry the same normalized URL.
 */
public record LeadIdentity(String normalizedName, String normalizedUrl) {
    /** Widths of the unique key columns in {@code leads}. */
    public static final int MAX_NAME_KEY_LENGTH = 500;
    public static final int MAX_URL_KEY_LENGTH = 2000;

    public static LeadIdentity of(Lead lead) {
        return of(lead.displayName(), lead.canonicalUrl());
    }

    public static LeadIdentity of(String displayName, String canonicalUrl) {
        return new LeadIdentity(normalizeName(displayName), normalizeUrl(canonicalUrl));
    }

    public static String normalizeName(String displayName) {
        if (displayName == null) {
            return "";
        }
        return cut(displayName.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT), MAX_NAME_KEY_LENGTH);
    }

    public static String normalizeUrl(String canonicalUrl) {
        if (canonicalUrl == null) {
            return null;
        }
        String trimmed = canonicalUrl.trim();
        return trimmed.isEmpty() ? null : cut(trimmed.toLowerCase(Locale.ROOT), MAX_URL_KEY_LENGTH);
    }

    public boolean hasUrl() {
        return normalizedUrl != null;
    }

    private static String cut(String value, int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}
