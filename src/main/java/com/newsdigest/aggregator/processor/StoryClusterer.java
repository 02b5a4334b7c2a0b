package com.newsdigest.aggregator.processor;

import com.newsdigest.aggregator.domain.model.Article;
import com.newsdigest.aggregator.domain.model.BiasRange;
import com.newsdigest.aggregator.domain.model.StoryGroup;
import com.newsdigest.aggregator.util.TitleSimilarity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Greedy single-pass grouping of articles that report the same event.
 *
 * <p>Each ungrouped article in turn becomes an anchor and pulls in every later
 * ungrouped article whose title is similar enough and whose publish time is
 * close enough to the anchor's. Membership is decided against the anchor only,
 * so the result depends on input order.</p>
 */
@Slf4j
@Component
public class StoryClusterer {

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.70;
    public static final Duration DEFAULT_TIME_WINDOW = Duration.ofHours(4);
    public static final int MIN_GROUP_SIZE = 2;

    @Value("${feeds.clustering.similarity-threshold:0.70}")
    private double similarityThreshold = DEFAULT_SIMILARITY_THRESHOLD;

    @Value("${feeds.clustering.time-window:4h}")
    private Duration timeWindow = DEFAULT_TIME_WINDOW;

    public List<StoryGroup> cluster(List<Article> articles) {
        if (articles == null || articles.size() < MIN_GROUP_SIZE) return List.of();

        List<Candidate> remaining = new LinkedList<>();
        for (Article a : articles) {
            remaining.add(new Candidate(a, TitleSimilarity.tokens(TitleSimilarity.normalize(a.getTitle()))));
        }

        List<StoryGroup> groups = new ArrayList<>();
        while (!remaining.isEmpty()) {
            Candidate anchor = remaining.remove(0);
            List<Article> members = new ArrayList<>();
            members.add(anchor.article());

            Iterator<Candidate> it = remaining.iterator();
            while (it.hasNext()) {
                Candidate c = it.next();
                if (belongsTo(anchor, c)) {
                    members.add(c.article());
                    it.remove();
                }
            }

            if (members.size() >= MIN_GROUP_SIZE) {
                groups.add(new StoryGroup(null, anchor.article(), members, biasOf(members).orElse(null)));
            }
        }

        // List.sort is stable: equal-sized groups keep anchor order
        groups.sort(Comparator.comparingInt(StoryGroup::sourceCount).reversed());
        log.debug("Cluster: articles={} groups={}", articles.size(), groups.size());
        return groups;
    }

    private boolean belongsTo(Candidate anchor, Candidate other) {
        double similarity = TitleSimilarity.jaccard(anchor.tokens(), other.tokens());
        if (similarity <= similarityThreshold) return false;

        Duration gap = Duration.between(anchor.article().getPublishedAt(), other.article().getPublishedAt()).abs();
        return gap.compareTo(timeWindow) < 0;
    }

    private static Optional<BiasRange> biasOf(List<Article> members) {
        return BiasRange.of(members.stream()
                .map(Article::assignedBias)
                .flatMap(Optional::stream)
                .toList());
    }

    private record Candidate(Article article, Set<String> tokens) {}
}
