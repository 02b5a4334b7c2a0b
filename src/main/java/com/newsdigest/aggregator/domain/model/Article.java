package com.newsdigest.aggregator.domain.model;

import com.newsdigest.aggregator.domain.enums.BiasSpectrum;
import com.newsdigest.aggregator.domain.enums.NewsCategory;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Canonical record built from one feed item.
 *
 * <p>The core fields are fixed at parse time. The flags below them belong to
 * downstream consumers (analysis, reading state) and are the only mutable part.</p>
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Article {

    private static final Duration RECENT_WINDOW = Duration.ofHours(24);

    @ToString.Include
    @EqualsAndHashCode.Include
    private final UUID id;
    @ToString.Include
    private final String title;
    private final NewsSource source;
    @ToString.Include
    private final String url;
    @ToString.Include
    private final Instant publishedAt;
    private final NewsCategory category;
    private final String description;
    private final String imageUrl;

    @Setter
    private volatile BiasSpectrum bias;
    @Setter
    private volatile boolean read;
    @Setter
    private volatile Instant readAt;
    @Setter
    private volatile boolean favorite;
    private volatile int importance = 5;

    @Builder(toBuilder = true)
    public Article(UUID id,
                   String title,
                   NewsSource source,
                   String url,
                   Instant publishedAt,
                   NewsCategory category,
                   String description,
                   String imageUrl) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        this.id = id != null ? id : UUID.randomUUID();
        this.title = title;
        this.source = Objects.requireNonNull(source, "source is required");
        this.url = url;
        this.publishedAt = Objects.requireNonNull(publishedAt, "publishedAt is required");
        this.category = category != null ? category : source.category();
        this.description = description;
        this.imageUrl = imageUrl;
    }

    public Optional<BiasSpectrum> assignedBias() {
        return Optional.ofNullable(bias);
    }

    public void setImportance(int importance) {
        if (importance < 1 || importance > 10) {
            throw new IllegalArgumentException("importance must be within [1,10]: " + importance);
        }
        this.importance = importance;
    }

    public void markRead(Instant at) {
        this.read = true;
        this.readAt = at;
    }

    /** Published less than 24 hours before {@code now}. */
    public boolean isRecent(Instant now) {
        return Duration.between(publishedAt, now).compareTo(RECENT_WINDOW) < 0;
    }
}
