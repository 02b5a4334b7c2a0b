package com.newsdigest.aggregator.processor;

import com.newsdigest.aggregator.domain.model.Article;
import com.newsdigest.aggregator.util.TitleSimilarity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Collapses near-identical titles, newest first, capped.
 *
 * <p>Articles are walked in the order given; the first one seen for a title
 * wins and later near-duplicates are dropped, even if they are newer.</p>
 */
@Slf4j
@Component
public class ArticleDeduplicator {

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.85;
    public static final int DEFAULT_MAX_ARTICLES = 100;

    @Value("${feeds.dedup.similarity-threshold:0.85}")
    private double similarityThreshold = DEFAULT_SIMILARITY_THRESHOLD;

    @Value("${feeds.dedup.max-articles:100}")
    private int maxArticles = DEFAULT_MAX_ARTICLES;

    public List<Article> deduplicate(List<Article> articles) {
        if (articles == null || articles.isEmpty()) return List.of();

        List<Article> kept = new ArrayList<>();
        List<Set<String>> keptTokens = new ArrayList<>();

        for (Article article : articles) {
            Set<String> tokens = TitleSimilarity.tokens(TitleSimilarity.normalize(article.getTitle()));
            if (isDuplicate(tokens, keptTokens)) {
                log.debug("Dedup: drop title='{}' sourceId={}", article.getTitle(), article.getSource().id());
                continue;
            }
            kept.add(article);
            keptTokens.add(tokens);
        }

        List<Article> out = kept.stream()
                .sorted(Comparator.comparing(Article::getPublishedAt).reversed())
                .limit(Math.max(0, maxArticles))
                .toList();

        log.debug("Dedup: in={} unique={} out={}", articles.size(), kept.size(), out.size());
        return out;
    }

    private boolean isDuplicate(Set<String> tokens, List<Set<String>> accepted) {
        for (Set<String> other : accepted) {
            if (TitleSimilarity.jaccard(tokens, other) > similarityThreshold) {
                return true;
            }
        }
        return false;
    }
}
