package com.newsdigest.aggregator.domain.model;

import com.newsdigest.aggregator.domain.enums.BiasSpectrum;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Two or more articles judged to cover the same event. Built fresh on every
 * clustering request and never cached.
 *
 * @param representative the anchor article, also the first element of {@code articles}
 * @param biasRange      aggregate over members with an assigned bias, {@code null} when none has one
 */
public record StoryGroup(
        UUID id,
        Article representative,
        List<Article> articles,
        BiasRange biasRange
) {
    public StoryGroup {
        Objects.requireNonNull(representative, "representative is required");
        articles = List.copyOf(articles);
        if (articles.size() < 2) {
            throw new IllegalArgumentException("A story group needs at least 2 articles, got " + articles.size());
        }
        id = id != null ? id : UUID.randomUUID();
    }

    public int sourceCount() {
        return articles.size();
    }

    public Optional<BiasRange> bias() {
        return Optional.ofNullable(biasRange);
    }

    /** Left/center/right counts over all members; an article with no bias counts as center. */
    public BiasDistribution biasDistribution() {
        int left = 0;
        int center = 0;
        int right = 0;
        for (Article a : articles) {
            BiasSpectrum b = a.getBias();
            double value = b != null ? b.value() : 0.0;
            if (value < -0.3) left++;
            else if (value > 0.3) right++;
            else center++;
        }
        return new BiasDistribution(left, center, right);
    }

    public record BiasDistribution(int left, int center, int right) {
        @Override
        public String toString() {
            return left + "L / " + center + "C / " + right + "R";
        }
    }
}
