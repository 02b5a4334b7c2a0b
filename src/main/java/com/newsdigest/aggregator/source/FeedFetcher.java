package com.newsdigest.aggregator.source;

import com.newsdigest.aggregator.domain.model.Article;
import com.newsdigest.aggregator.domain.model.NewsSource;
import com.newsdigest.aggregator.exception.FeedFetchException;
import com.newsdigest.aggregator.exception.FetchFailure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * One fetch+parse unit of work: downloads a single feed and turns it into
 * articles. Transport and parse failures are logged and come back as an empty
 * list, so a dead feed never fails the batch it belongs to.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeedFetcher {

    private final HttpClient feedHttpClient;
    private final FeedParser feedParser;
    private final Clock clock;

    @Value("${feeds.http.user-agent:NewsDigestAggregator/1.0 (+https://example.com)}")
    private String userAgent;

    @Value("${feeds.http.request-timeout-seconds:15}")
    private int requestTimeoutSeconds = 15;

    public List<Article> fetch(NewsSource source) {
        long t0 = System.currentTimeMillis();
        log.debug("Feed: fetching sourceId={} sourceName='{}' feedUrl={}", source.id(), source.name(), source.feedUrl());

        try {
            FeedResponse response = download(source);
            List<Article> articles = feedParser.parse(response.body(), response.contentType(), source, clock.instant());

            log.info("Feed: done sourceId={} articles={} tookMs={}",
                    source.id(), articles.size(), System.currentTimeMillis() - t0);
            return articles;

        } catch (FeedFetchException e) {
            log.warn("Feed: failed sourceId={} failure={} err={}", source.id(), e.getFailure(), e.getMessage());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Feed: interrupted sourceId={}", source.id());
            return List.of();
        }
    }

    private FeedResponse download(NewsSource source) throws InterruptedException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(source.feedUrl()))
                    .timeout(Duration.ofSeconds(Math.max(1, requestTimeoutSeconds)))
                    .GET()
                    .header("User-Agent", userAgent)
                    .header("Accept", "application/rss+xml, application/atom+xml, application/xml;q=0.9, text/xml;q=0.8, */*;q=0.1")
                    .build();
        } catch (IllegalArgumentException e) {
            throw new FeedFetchException("Invalid feed URL " + source.feedUrl(), FetchFailure.INVALID_URL, e);
        }

        HttpResponse<byte[]> response;
        try {
            response = feedHttpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new FeedFetchException("Timed out fetching " + source.feedUrl(), FetchFailure.TIMEOUT, e);
        } catch (ConnectException | UnknownHostException e) {
            throw new FeedFetchException("Cannot connect to " + source.feedUrl(), FetchFailure.NETWORK, e);
        } catch (IOException e) {
            throw new FeedFetchException("I/O error fetching " + source.feedUrl() + ": " + e, FetchFailure.NETWORK, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new FeedFetchException("Non-2xx status=" + status + " url=" + source.feedUrl(), FetchFailure.HTTP_STATUS);
        }

        byte[] body = response.body();
        if (body == null || body.length == 0) {
            throw new FeedFetchException("Empty body from " + source.feedUrl(), FetchFailure.PARSE);
        }

        String contentType = response.headers() != null
                ? response.headers().firstValue("Content-Type").orElse(null)
                : null;
        return new FeedResponse(body, contentType);
    }

    private record FeedResponse(byte[] body, String contentType) {}
}
