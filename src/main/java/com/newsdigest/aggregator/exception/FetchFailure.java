package com.newsdigest.aggregator.exception;

public enum FetchFailure {
    INVALID_URL,   // feed URL cannot be turned into a request
    HTTP_STATUS,   // response outside 2xx
    TIMEOUT,       // connect/read timeout from the transport
    NETWORK,       // connection refused, DNS, reset
    PARSE          // body is not a parseable feed document
}
