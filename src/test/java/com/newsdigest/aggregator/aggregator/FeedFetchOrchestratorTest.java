package com.newsdigest.aggregator.aggregator;

import com.newsdigest.aggregator.aggregator.BaseAggregator.MergeOrder;
import com.newsdigest.aggregator.domain.enums.NewsCategory;
import com.newsdigest.aggregator.domain.model.Article;
import com.newsdigest.aggregator.domain.model.NewsSource;
import com.newsdigest.aggregator.exception.FeedFetchException;
import com.newsdigest.aggregator.exception.FetchFailure;
import com.newsdigest.aggregator.registry.SourceRegistry;
import com.newsdigest.aggregator.source.FeedFetcher;
import com.newsdigest.aggregator.support.TestArticles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.newsdigest.aggregator.support.TestArticles.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeedFetchOrchestratorTest {

    @Mock SourceRegistry sourceRegistry;
    @Mock FeedFetcher feedFetcher;

    ExecutorService executor;
    FeedFetchOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(5);
        orchestrator = new FeedFetchOrchestrator(sourceRegistry, feedFetcher, executor);
        ReflectionTestUtils.setField(orchestrator, "sourceTimeout", Duration.ofMillis(500));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void fetchCategory_failingAndSlowSources_contributeNothing() {
        NewsSource a = TestArticles.source("a");
        NewsSource b = TestArticles.source("b");
        NewsSource c = TestArticles.source("c");
        NewsSource malformed = TestArticles.source("malformed");
        NewsSource slow = TestArticles.source("slow");

        Article fromA = TestArticles.article("Alpha story", NOW, "a");
        Article fromB = TestArticles.article("Bravo story", NOW, "b");
        Article fromC = TestArticles.article("Charlie story", NOW, "c");

        when(sourceRegistry.sourcesFor(NewsCategory.US)).thenReturn(List.of(a, malformed, b, slow, c));
        when(feedFetcher.fetch(a)).thenReturn(List.of(fromA));
        when(feedFetcher.fetch(b)).thenReturn(List.of(fromB));
        when(feedFetcher.fetch(c)).thenReturn(List.of(fromC));
        when(feedFetcher.fetch(malformed)).thenThrow(new FeedFetchException("bad xml", FetchFailure.PARSE));
        when(feedFetcher.fetch(slow)).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return List.of(TestArticles.article("Too late", NOW, "slow"));
        });

        long t0 = System.currentTimeMillis();
        List<Article> out = orchestrator.fetchCategory(NewsCategory.US);
        long took = System.currentTimeMillis() - t0;

        assertThat(out).containsExactlyInAnyOrder(fromA, fromB, fromC);
        assertThat(took).isLessThan(4_000);

        verify(sourceRegistry).recordFetch(a, 1);
        verify(sourceRegistry).recordFetch(b, 1);
        verify(sourceRegistry).recordFetch(c, 1);
        verify(sourceRegistry, never()).recordFetch(eq(malformed), anyInt());
        verify(sourceRegistry, never()).recordFetch(eq(slow), anyInt());
    }

    @Test
    void fetchCategory_moreSourcesThanWorkers_queuedSourcesStillContribute() {
        ExecutorService twoWorkers = Executors.newFixedThreadPool(2);
        try {
            FeedFetchOrchestrator narrow = new FeedFetchOrchestrator(sourceRegistry, feedFetcher, twoWorkers);
            ReflectionTestUtils.setField(narrow, "sourceTimeout", Duration.ofMillis(1_000));

            List<NewsSource> sources = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                NewsSource s = TestArticles.source("queued-" + i);
                Article a = TestArticles.article("Queued story " + i, NOW, s.id());
                sources.add(s);
                when(feedFetcher.fetch(s)).thenAnswer(inv -> {
                    Thread.sleep(600);
                    return List.of(a);
                });
            }
            when(sourceRegistry.sourcesFor(NewsCategory.TECHNOLOGY)).thenReturn(sources);

            List<Article> out = narrow.fetchCategory(NewsCategory.TECHNOLOGY);

            assertThat(out).hasSize(6);
        } finally {
            twoWorkers.shutdownNow();
        }
    }

    @Test
    void fetchCategory_sourceMergeOrder_followsRegistryOrder() {
        ReflectionTestUtils.setField(orchestrator, "mergeOrder", MergeOrder.SOURCE);

        NewsSource first = TestArticles.source("first");
        NewsSource second = TestArticles.source("second");
        Article one = TestArticles.article("One", NOW, "first");
        Article two = TestArticles.article("Two", NOW, "second");
        Article three = TestArticles.article("Three", NOW, "second");

        when(sourceRegistry.sourcesFor(NewsCategory.WORLD)).thenReturn(List.of(first, second));
        when(feedFetcher.fetch(first)).thenAnswer(inv -> {
            Thread.sleep(150);
            return List.of(one);
        });
        when(feedFetcher.fetch(second)).thenReturn(List.of(two, three));

        assertThat(orchestrator.fetchCategory(NewsCategory.WORLD)).containsExactly(one, two, three);
    }

    @Test
    void fetchCategory_noSources_returnsEmpty() {
        when(sourceRegistry.sourcesFor(NewsCategory.LOCAL)).thenReturn(List.of());

        assertThat(orchestrator.fetchCategory(NewsCategory.LOCAL)).isEmpty();
        verifyNoInteractions(feedFetcher);
    }

    @Test
    void fetchCategory_nullCategory_isRejected() {
        assertThatThrownBy(() -> orchestrator.fetchCategory(null)).isInstanceOf(NullPointerException.class);
    }
}
