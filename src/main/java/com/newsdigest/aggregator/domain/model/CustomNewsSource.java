package com.newsdigest.aggregator.domain.model;

import com.newsdigest.aggregator.domain.enums.BiasSpectrum;
import com.newsdigest.aggregator.domain.enums.NewsCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * User-added feed. Instances are never modified; changes are saved as copies
 * made with {@link #toBuilder()}.
 */
@Getter
@AllArgsConstructor
@Builder(toBuilder = true)
public class CustomNewsSource {

    public static final String ID_PREFIX = "custom-";

    @Builder.Default
    private final UUID id = UUID.randomUUID();

    private final String name;

    private final String feedUrl;

    private final NewsCategory category;

    @Builder.Default
    private final BiasSpectrum bias = BiasSpectrum.CENTER;

    @Builder.Default
    private final int credibility = 70;

    @Builder.Default
    private final double factuality = 0.75;

    @Builder.Default
    private final boolean enabled = true;

    @Builder.Default
    private final Instant addedAt = Instant.now();

    private final Instant lastFetchedAt;

    private final int articleCount;

    public String sourceId() {
        return ID_PREFIX + id;
    }

    public NewsSource toNewsSource() {
        return NewsSource.builder()
                .id(sourceId())
                .name(name)
                .feedUrl(feedUrl)
                .category(category)
                .bias(bias)
                .credibility(credibility)
                .factuality(factuality)
                .build();
    }
}
