package com.newsdigest.aggregator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class FeedFetchConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService feedFetchExecutor(@Value("${feeds.fetch.pool-size:8}") int poolSize) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = r -> {
            Thread t = new Thread(r, "feed-fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(Math.max(1, poolSize), threads);
    }

    @Bean
    public HttpClient feedHttpClient(@Value("${feeds.http.connect-timeout-seconds:7}") int connectTimeoutSeconds) {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(Math.max(1, connectTimeoutSeconds)))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
