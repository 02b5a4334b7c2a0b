package com.newsdigest.aggregator.scheduler;

import com.newsdigest.aggregator.service.NewsFeedService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "feeds.refresh", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FeedRefreshScheduler {

    private final NewsFeedService newsFeedService;

    @Scheduled(fixedDelayString = "${feeds.refresh.interval-ms:3600000}",
            initialDelayString = "${feeds.refresh.initial-delay-ms:10000}")
    public void run() {
        UUID correlationId = UUID.randomUUID();
        log.info("Scheduled refresh started correlationId={}", correlationId);
        newsFeedService.warmAll(correlationId);
        log.info("Scheduled refresh finished correlationId={}", correlationId);
    }
}
