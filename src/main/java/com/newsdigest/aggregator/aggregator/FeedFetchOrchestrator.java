package com.newsdigest.aggregator.aggregator;

import com.newsdigest.aggregator.domain.enums.NewsCategory;
import com.newsdigest.aggregator.domain.model.Article;
import com.newsdigest.aggregator.domain.model.NewsSource;
import com.newsdigest.aggregator.registry.SourceRegistry;
import com.newsdigest.aggregator.source.FeedFetcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Fetches every source of a category in parallel and merges the results.
 * Unordered and not deduplicated.
 */
@Slf4j
@Component
public class FeedFetchOrchestrator extends BaseAggregator<NewsSource, Article> {

    private final SourceRegistry sourceRegistry;
    private final FeedFetcher feedFetcher;

    @Value("${feeds.fetch.source-timeout:20s}")
    private Duration sourceTimeout = Duration.ofSeconds(20);

    @Value("${feeds.fetch.merge-order:COMPLETION}")
    private MergeOrder mergeOrder = MergeOrder.COMPLETION;

    public FeedFetchOrchestrator(SourceRegistry sourceRegistry, FeedFetcher feedFetcher, ExecutorService feedFetchExecutor) {
        super(feedFetchExecutor);
        this.sourceRegistry = sourceRegistry;
        this.feedFetcher = feedFetcher;
    }

    public List<Article> fetchCategory(NewsCategory category) {
        Objects.requireNonNull(category, "category");
        long t0 = System.currentTimeMillis();

        List<NewsSource> sources = sourceRegistry.sourcesFor(category);
        if (sources.isEmpty()) {
            log.info("Fetch: no sources category={}", category);
            return List.of();
        }

        List<Article> articles = aggregate(sources, sourceTimeout, mergeOrder);
        log.info("Fetch: done category={} sources={} articles={} tookMs={}",
                category, sources.size(), articles.size(), System.currentTimeMillis() - t0);
        return articles;
    }

    @Override
    protected List<Article> fetchOne(NewsSource source) {
        return feedFetcher.fetch(source);
    }

    @Override
    protected String describe(NewsSource source) {
        return source.id();
    }

    @Override
    protected void onFetched(NewsSource source, List<Article> data) {
        sourceRegistry.recordFetch(source, data.size());
    }
}
