package com.newsdigest.aggregator.service;

import com.newsdigest.aggregator.cache.CategoryFeedCache;
import com.newsdigest.aggregator.domain.enums.NewsCategory;
import com.newsdigest.aggregator.domain.model.Article;
import com.newsdigest.aggregator.domain.model.StoryGroup;
import com.newsdigest.aggregator.processor.StoryClusterer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class NewsFeedService {

    static final int BREAKING_NEWS_LIMIT = 5;

    private final CategoryFeedCache cache;
    private final StoryClusterer storyClusterer;
    private final Clock clock;

    public List<Article> articles(NewsCategory category) {
        return cache.getOrFetch(category);
    }

    public Map<NewsCategory, List<Article>> allCategories() {
        Map<NewsCategory, List<Article>> out = new EnumMap<>(NewsCategory.class);
        for (NewsCategory c : NewsCategory.values()) {
            out.put(c, cache.getOrFetch(c));
        }
        return out;
    }

    public List<StoryGroup> storyGroups(NewsCategory category) {
        return storyClusterer.cluster(cache.getOrFetch(category));
    }

    public List<Article> refresh(NewsCategory category) {
        cache.invalidate(category);
        return cache.getOrFetch(category);
    }

    /** Up to five US articles published within the last 24 hours, newest first. */
    public List<Article> breakingNews() {
        Instant now = clock.instant();
        return cache.getOrFetch(NewsCategory.US).stream()
                .filter(a -> a.isRecent(now))
                .limit(BREAKING_NEWS_LIMIT)
                .toList();
    }

    /** Refreshes every stale category. A failing category is logged and does not stop the others. */
    public void warmAll(UUID correlationId) {
        MDC.put("corrId", correlationId.toString());
        long t0 = System.currentTimeMillis();
        int failed = 0;
        try {
            for (NewsCategory c : NewsCategory.values()) {
                try {
                    cache.getOrFetch(c);
                } catch (RuntimeException e) {
                    failed++;
                    log.error("Warm-up failed category={} corrId={}", c, correlationId, e);
                }
            }
            log.info("Warm-up finished corrId={} categories={} failed={} tookMs={}",
                    correlationId, NewsCategory.values().length, failed, System.currentTimeMillis() - t0);
        } finally {
            MDC.remove("corrId");
        }
    }
}
