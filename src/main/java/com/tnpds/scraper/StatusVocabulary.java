package com.tnpds.scraper;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Indicator texts that mean online or offline. Matching is exact after trimming, collapsing
 * whitespace and case folding; anything else is {@link ShopStatus#UNKNOWN}.
 */
public final class StatusVocabulary {
    private final Set<String> online;
    private final Set<String> offline;

    public StatusVocabulary(Set<String> online, Set<String> offline) {
        this.online = normalizeAll(online);
        this.offline = normalizeAll(offline);
        Set<String> overlap = new LinkedHashSet<>(this.online);
        overlap.retainAll(this.offline);
        if (!overlap.isEmpty()) {
            throw new IllegalArgumentException("Status tokens listed as both online and offline: " + overlap);
        }
    }

    /**
     * Builds a vocabulary from two comma-separated token lists.
     */
    public static StatusVocabulary parse(String onlineTokens, String offlineTokens) {
        return new StatusVocabulary(split(onlineTokens), split(offlineTokens));
    }

    public ShopStatus classify(String indicatorText) {
        String token = normalize(indicatorText);
        if (online.contains(token)) return ShopStatus.ONLINE;
        if (offline.contains(token)) return ShopStatus.OFFLINE;
        return ShopStatus.UNKNOWN;
    }

    public Set<String> onlineTokens() {
        return online;
    }

    public Set<String> offlineTokens() {
        return offline;
    }

    static String normalize(String text) {
        return text == null ? "" : text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static Set<String> split(String tokens) {
        if (tokens == null || tokens.isBlank()) return Set.of();
        return Arrays.stream(tokens.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static Set<String> normalizeAll(Set<String> tokens) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String token : tokens) {
            String n = normalize(token);
            if (!n.isEmpty()) normalized.add(n);
        }
        return Collections.unmodifiableSet(normalized);
    }
}
