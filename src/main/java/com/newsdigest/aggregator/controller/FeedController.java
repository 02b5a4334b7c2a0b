package com.newsdigest.aggregator.controller;

import com.newsdigest.aggregator.cache.CategoryFeedCache;
import com.newsdigest.aggregator.domain.enums.BiasSpectrum;
import com.newsdigest.aggregator.domain.enums.NewsCategory;
import com.newsdigest.aggregator.domain.model.Article;
import com.newsdigest.aggregator.domain.model.BiasRange;
import com.newsdigest.aggregator.domain.model.StoryGroup;
import com.newsdigest.aggregator.service.NewsFeedService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/feeds")
@RequiredArgsConstructor
public class FeedController {

    private final NewsFeedService newsFeedService;
    private final CategoryFeedCache cache;

    @GetMapping("/categories")
    public ResponseEntity<List<CategoryResponse>> listCategories() {
        List<CategoryResponse> categories = Arrays.stream(NewsCategory.values())
                .map(c -> new CategoryResponse(c, c.displayName(), cache.lastRefreshed(c).orElse(null)))
                .toList();
        return ResponseEntity.ok(categories);
    }

    @GetMapping("/breaking")
    public ResponseEntity<List<ArticleResponse>> breakingNews() {
        return ResponseEntity.ok(toResponses(newsFeedService.breakingNews()));
    }

    @GetMapping("/{category}")
    public ResponseEntity<List<ArticleResponse>> articles(@PathVariable("category") String category) {
        return ResponseEntity.ok(toResponses(newsFeedService.articles(NewsCategory.fromValue(category))));
    }

    @GetMapping("/{category}/stories")
    public ResponseEntity<List<StoryGroupResponse>> stories(@PathVariable("category") String category) {
        List<StoryGroupResponse> groups = newsFeedService.storyGroups(NewsCategory.fromValue(category)).stream()
                .map(StoryGroupResponse::from)
                .toList();
        return ResponseEntity.ok(groups);
    }

    @PostMapping("/{category}/refresh")
    public ResponseEntity<List<ArticleResponse>> refresh(@PathVariable("category") String category) {
        NewsCategory c = NewsCategory.fromValue(category);
        log.info("Manual refresh trigger category={}", c);
        return ResponseEntity.ok(toResponses(newsFeedService.refresh(c)));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        cache.invalidateAll();
        return ResponseEntity.noContent().build();
    }

    private static List<ArticleResponse> toResponses(List<Article> articles) {
        return articles.stream().map(ArticleResponse::from).toList();
    }

    public record CategoryResponse(NewsCategory category, String displayName, Instant lastRefreshedAt) {}

    public record ArticleResponse(
            UUID id,
            String title,
            String sourceId,
            String sourceName,
            BiasSpectrum sourceBias,
            int sourceCredibility,
            String url,
            Instant publishedAt,
            NewsCategory category,
            String description,
            String imageUrl,
            BiasSpectrum bias
    ) {
        static ArticleResponse from(Article a) {
            return new ArticleResponse(
                    a.getId(),
                    a.getTitle(),
                    a.getSource().id(),
                    a.getSource().name(),
                    a.getSource().bias(),
                    a.getSource().credibility(),
                    a.getUrl(),
                    a.getPublishedAt(),
                    a.getCategory(),
                    a.getDescription(),
                    a.getImageUrl(),
                    a.getBias()
            );
        }
    }

    public record StoryGroupResponse(
            UUID id,
            ArticleResponse representative,
            List<ArticleResponse> articles,
            int sourceCount,
            BiasRange biasRange,
            String biasDistribution
    ) {
        static StoryGroupResponse from(StoryGroup g) {
            return new StoryGroupResponse(
                    g.id(),
                    ArticleResponse.from(g.representative()),
                    toResponses(g.articles()),
                    g.sourceCount(),
                    g.biasRange(),
                    g.biasDistribution().toString()
            );
        }
    }
}
