package com.newsdigest.aggregator.exception;

import lombok.Getter;

@Getter
public class FeedFetchException extends RuntimeException {

    private final FetchFailure failure;

    public FeedFetchException(String message, FetchFailure failure, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public FeedFetchException(String message, FetchFailure failure) {
        this(message, failure, null);
    }
}
