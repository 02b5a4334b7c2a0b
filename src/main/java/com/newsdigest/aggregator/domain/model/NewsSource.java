package com.newsdigest.aggregator.domain.model;

import com.newsdigest.aggregator.domain.enums.BiasSpectrum;
import com.newsdigest.aggregator.domain.enums.NewsCategory;
import lombok.Builder;

import java.util.Objects;

@Builder
public record NewsSource(
        String id,
        String name,
        String feedUrl,
        NewsCategory category,
        BiasSpectrum bias,
        int credibility,
        double factuality
) {
    public NewsSource {
        requireText(id, "id");
        requireText(name, "name");
        requireText(feedUrl, "feedUrl");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(bias, "bias is required");
        if (credibility < 0 || credibility > 100) {
            throw new IllegalArgumentException("credibility must be within [0,100]: " + credibility);
        }
        if (factuality < 0.0 || factuality > 1.0) {
            throw new IllegalArgumentException("factuality must be within [0.0,1.0]: " + factuality);
        }
    }

    public String credibilityLabel() {
        if (credibility >= 90) return "High";
        if (credibility >= 75) return "Good";
        if (credibility >= 60) return "Fair";
        return "Low";
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
