package com.newsdigest.aggregator.cache;

import com.newsdigest.aggregator.aggregator.FeedFetchOrchestrator;
import com.newsdigest.aggregator.domain.enums.NewsCategory;
import com.newsdigest.aggregator.domain.model.Article;
import com.newsdigest.aggregator.processor.ArticleDeduplicator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-category article lists with a time-to-live.
 *
 * <p>A fresh entry is served without touching the network. A stale or missing
 * one is rebuilt under that category's lock, so concurrent callers for the same
 * category trigger a single fetch while other categories refresh independently.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CategoryFeedCache {

    private final FeedFetchOrchestrator orchestrator;
    private final ArticleDeduplicator deduplicator;
    private final Clock clock;

    @Value("${feeds.cache.ttl:1h}")
    private Duration ttl = Duration.ofHours(1);

    private final Map<NewsCategory, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Map<NewsCategory, Object> locks = locksPerCategory();

    public List<Article> getOrFetch(NewsCategory category) {
        Objects.requireNonNull(category, "category");

        CacheEntry entry = entries.get(category);
        if (entry != null && entry.isFresh(clock.instant(), ttl)) {
            log.debug("Cache: hit category={} articles={}", category, entry.articles().size());
            return entry.articles();
        }

        synchronized (locks.get(category)) {
            entry = entries.get(category);
            if (entry != null && entry.isFresh(clock.instant(), ttl)) {
                return entry.articles();
            }
            return refresh(category).articles();
        }
    }

    public void invalidate(NewsCategory category) {
        if (entries.remove(category) != null) {
            log.info("Cache: invalidated category={}", category);
        }
    }

    public void invalidateAll() {
        entries.clear();
        log.info("Cache: invalidated all categories");
    }

    public Optional<Instant> lastRefreshed(NewsCategory category) {
        return Optional.ofNullable(entries.get(category)).map(CacheEntry::refreshedAt);
    }

    private CacheEntry refresh(NewsCategory category) {
        List<Article> fetched = orchestrator.fetchCategory(category);
        List<Article> deduped = deduplicator.deduplicate(fetched);

        CacheEntry fresh = new CacheEntry(deduped, clock.instant());
        entries.put(category, fresh);
        log.info("Cache: refreshed category={} fetched={} stored={}", category, fetched.size(), deduped.size());
        return fresh;
    }

    private static Map<NewsCategory, Object> locksPerCategory() {
        Map<NewsCategory, Object> map = new EnumMap<>(NewsCategory.class);
        for (NewsCategory c : NewsCategory.values()) {
            map.put(c, new Object());
        }
        return map;
    }
}
