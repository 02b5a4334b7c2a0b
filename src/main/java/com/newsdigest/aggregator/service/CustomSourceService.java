package com.newsdigest.aggregator.service;

import com.newsdigest.aggregator.cache.CategoryFeedCache;
import com.newsdigest.aggregator.domain.enums.BiasSpectrum;
import com.newsdigest.aggregator.domain.enums.NewsCategory;
import com.newsdigest.aggregator.domain.model.Article;
import com.newsdigest.aggregator.domain.model.CustomNewsSource;
import com.newsdigest.aggregator.domain.model.NewsSource;
import com.newsdigest.aggregator.registry.SourceRegistry;
import com.newsdigest.aggregator.repository.CustomSourceRepository;
import com.newsdigest.aggregator.source.FeedFetcher;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * User-managed feeds. Every change drops the cached articles of the affected
 * categories so the next read sees it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustomSourceService {

    private final CustomSourceRepository repository;
    private final SourceRegistry sourceRegistry;
    private final FeedFetcher feedFetcher;
    private final CategoryFeedCache cache;
    private final Clock clock;

    public List<CustomNewsSource> list() {
        return repository.findAll();
    }

    public CustomNewsSource get(UUID id) {
        return repository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Custom source not found: " + id));
    }

    public CustomNewsSource add(SourceDraft draft) {
        if (draft.name() == null || draft.name().isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (draft.category() == null) {
            throw new IllegalArgumentException("category is required");
        }
        String url = requireFeedUrl(draft.feedUrl());
        validateRatings(draft);
        if (sourceRegistry.isDuplicateUrl(url)) {
            throw new IllegalArgumentException("Source URL already exists: " + url);
        }

        CustomNewsSource.CustomNewsSourceBuilder builder = CustomNewsSource.builder()
                .name(draft.name().trim())
                .feedUrl(url)
                .category(draft.category())
                .addedAt(clock.instant());
        if (draft.bias() != null) builder.bias(draft.bias());
        if (draft.credibility() != null) builder.credibility(draft.credibility());
        if (draft.factuality() != null) builder.factuality(draft.factuality());

        CustomNewsSource saved = repository.save(builder.build());
        cache.invalidate(saved.getCategory());
        log.info("Custom source added sourceId={} category={} feedUrl={}", saved.sourceId(), saved.getCategory(), url);
        return saved;
    }

    /** Applies the non-null fields of {@code changes}. */
    public CustomNewsSource update(UUID id, SourceDraft changes) {
        CustomNewsSource current = get(id);
        validateRatings(changes);

        CustomNewsSource.CustomNewsSourceBuilder builder = current.toBuilder();
        if (changes.feedUrl() != null) {
            String url = requireFeedUrl(changes.feedUrl());
            if (!url.equalsIgnoreCase(current.getFeedUrl()) && sourceRegistry.isDuplicateUrl(url)) {
                throw new IllegalArgumentException("Source URL already exists: " + url);
            }
            builder.feedUrl(url);
        }
        if (changes.name() != null && !changes.name().isBlank()) builder.name(changes.name().trim());
        if (changes.category() != null) builder.category(changes.category());
        if (changes.bias() != null) builder.bias(changes.bias());
        if (changes.credibility() != null) builder.credibility(changes.credibility());
        if (changes.factuality() != null) builder.factuality(changes.factuality());

        CustomNewsSource updated = repository.save(builder.build());

        cache.invalidate(current.getCategory());
        cache.invalidate(updated.getCategory());
        log.info("Custom source updated sourceId={}", updated.sourceId());
        return updated;
    }

    public void remove(UUID id) {
        CustomNewsSource source = get(id);
        repository.deleteById(id);
        cache.invalidate(source.getCategory());
        log.info("Custom source removed sourceId={}", source.sourceId());
    }

    public CustomNewsSource toggle(UUID id) {
        CustomNewsSource current = get(id);
        CustomNewsSource toggled = repository.save(current.toBuilder().enabled(!current.isEnabled()).build());
        cache.invalidate(toggled.getCategory());
        log.info("Custom source toggled sourceId={} enabled={}", toggled.sourceId(), toggled.isEnabled());
        return toggled;
    }

    /**
     * Fetches and parses a candidate feed without registering it. Success means
     * at least one article came out of it.
     */
    public FeedValidationResult validateFeed(String feedUrl) {
        String url = requireFeedUrl(feedUrl);
        NewsSource candidate = NewsSource.builder()
                .id("validation")
                .name("Validation")
                .feedUrl(url)
                .category(NewsCategory.US)
                .bias(BiasSpectrum.CENTER)
                .credibility(0)
                .factuality(0.0)
                .build();

        List<Article> articles = feedFetcher.fetch(candidate);
        log.info("Feed validation feedUrl={} articles={}", url, articles.size());
        return new FeedValidationResult(!articles.isEmpty(), articles.size());
    }

    private static String requireFeedUrl(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("feedUrl is required");
        }
        String url = value.trim();
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("feedUrl is not a valid URL: " + url, e);
        }
        String scheme = uri.getScheme();
        if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw new IllegalArgumentException("feedUrl must be an absolute http(s) URL: " + url);
        }
        return url;
    }

    private static void validateRatings(SourceDraft draft) {
        if (draft.credibility() != null && (draft.credibility() < 0 || draft.credibility() > 100)) {
            throw new IllegalArgumentException("credibility must be within [0,100]: " + draft.credibility());
        }
        if (draft.factuality() != null && (draft.factuality() < 0.0 || draft.factuality() > 1.0)) {
            throw new IllegalArgumentException("factuality must be within [0,1]: " + draft.factuality());
        }
    }

    @Builder
    public record SourceDraft(
            String name,
            String feedUrl,
            NewsCategory category,
            BiasSpectrum bias,
            Integer credibility,
            Double factuality
    ) {}

    public record FeedValidationResult(boolean success, int articleCount) {}
}
