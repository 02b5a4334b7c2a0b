package com.newsdigest.aggregator.domain.enums;

import java.util.Arrays;
import java.util.Locale;

public enum NewsCategory {
    US("US"),
    WORLD("World"),
    LOCAL("Local"),
    BUSINESS("Business"),
    TECHNOLOGY("Technology"),
    ENTERTAINMENT("Entertainment"),
    SPORTS("Sports"),
    SCIENCE("Science"),
    HEALTH("Health");

    private final String displayName;

    NewsCategory(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolves a category by enum name or display name, ignoring case.
     *
     * @throws IllegalArgumentException if the value names no category
     */
    public static NewsCategory fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Category must not be blank");
        }
        String v = value.trim();
        return Arrays.stream(values())
                .filter(c -> c.name().equalsIgnoreCase(v) || c.displayName.equalsIgnoreCase(v))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown category: " + v.toLowerCase(Locale.ROOT)));
    }
}
