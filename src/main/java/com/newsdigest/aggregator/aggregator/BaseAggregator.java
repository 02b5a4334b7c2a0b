package com.newsdigest.aggregator.aggregator;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Fans one unit of work per source out to an executor and joins all of them.
 * A unit that throws or runs past the timeout contributes nothing; the other
 * units are never cancelled because of it. The timeout covers execution only,
 * not time waiting for a free worker.
 *
 * @param <S> source descriptor
 * @param <T> item produced by a source
 */
@Slf4j
public abstract class BaseAggregator<S, T> {

    public enum MergeOrder {
        /** Contributions in the order their units finished. */
        COMPLETION,
        /** Contributions in the order the sources were given. */
        SOURCE
    }

    private final Executor executor;

    protected BaseAggregator(Executor executor) {
        this.executor = executor;
    }

    protected abstract List<T> fetchOne(S source);

    protected abstract String describe(S source);

    /** Called with the result of every unit that finished in time. */
    protected void onFetched(S source, List<T> data) {
    }

    protected List<T> aggregate(List<S> sources, Duration timeout, MergeOrder mergeOrder) {
        Queue<List<T>> arrivals = new ConcurrentLinkedQueue<>();

        List<CompletableFuture<List<T>>> futures = sources.stream()
                .map(src -> startUnit(src, timeout)
                        .thenApply(data -> {
                            onFetched(src, data);
                            log.debug("Fetched {} entries from {}", data.size(), describe(src));
                            return data;
                        })
                        .exceptionally(ex -> {
                            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                            if (cause instanceof TimeoutException) {
                                log.warn("Source {} timed out after {}ms", describe(src), timeout.toMillis());
                            } else {
                                log.warn("Source {} failed: {}", describe(src), cause.toString());
                            }
                            return List.<T>of();
                        })
                        .thenApply(data -> {
                            arrivals.add(data);
                            return data;
                        }))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        Collection<List<T>> ordered = mergeOrder == MergeOrder.SOURCE
                ? futures.stream().map(CompletableFuture::join).toList()
                : arrivals;

        return ordered.stream()
                .flatMap(List::stream)
                .collect(Collectors.toList());
    }

    /**
     * Submits one unit. Its deadline starts when a worker picks it up, so time
     * spent queued behind other units does not count against it.
     */
    private CompletableFuture<List<T>> startUnit(S src, Duration timeout) {
        CompletableFuture<Void> started = new CompletableFuture<>();
        CompletableFuture<List<T>> work = CompletableFuture.supplyAsync(() -> {
            started.complete(null);
            return fetchOne(src);
        }, executor);
        return started.thenCompose(v -> work.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }
}
