package com.newsdigest.aggregator.util;

import lombok.experimental.UtilityClass;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Lexical title similarity shared by deduplication and story clustering.
 */
@UtilityClass
public class TitleSimilarity {

    private final Pattern NOT_WORD_OR_SPACE = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private final Pattern WS = Pattern.compile("\\s+");

    /** Lowercases and strips everything that is not a letter, digit or whitespace. */
    public String normalize(String title) {
        if (title == null) return "";
        return NOT_WORD_OR_SPACE.matcher(title.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    public Set<String> tokens(String normalizedTitle) {
        if (normalizedTitle == null || normalizedTitle.isBlank()) return Set.of();
        return Arrays.stream(WS.split(normalizedTitle.trim()))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toSet());
    }

    /** Intersection over union of two token sets; 0.0 when both are empty. */
    public double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) return 0.0;

        Set<String> union = new HashSet<>(a);
        union.addAll(b);

        int intersection = 0;
        for (String t : a) {
            if (b.contains(t)) intersection++;
        }
        return (double) intersection / union.size();
    }

    public double similarity(String titleA, String titleB) {
        return jaccard(tokens(normalize(titleA)), tokens(normalize(titleB)));
    }
}
