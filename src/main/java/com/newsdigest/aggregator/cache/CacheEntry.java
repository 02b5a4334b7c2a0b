package com.newsdigest.aggregator.cache;

import com.newsdigest.aggregator.domain.model.Article;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Deduplicated article list of one category and the moment it was stored.
 * Replaced as a whole on refresh.
 */
public record CacheEntry(List<Article> articles, Instant refreshedAt) {

    public CacheEntry {
        articles = List.copyOf(articles);
    }

    public boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(refreshedAt, now).compareTo(ttl) < 0;
    }
}
