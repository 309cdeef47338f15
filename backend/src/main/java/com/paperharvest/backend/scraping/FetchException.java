package com.paperharvest.backend.scraping;

import lombok.Getter;

/**
 * Failure of a single page fetch. Timeouts, 429, 5xx and connection failures are retryable.
 */
@Getter
public class FetchException extends RuntimeException {

    public enum Kind {
        TIMEOUT,
        HTTP_ERROR,
        NETWORK
    }

    private final Kind kind;
    private final String url;
    // Only set for HTTP_ERROR
    private final Integer status;

    private FetchException(Kind kind, String url, Integer status, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.url = url;
        this.status = status;
    }

    public static FetchException timeout(String url, Throwable cause) {
        return new FetchException(Kind.TIMEOUT, url, null, "Timed out fetching " + url, cause);
    }

    public static FetchException httpError(String url, int status) {
        return new FetchException(Kind.HTTP_ERROR, url, status, "HTTP " + status + " fetching " + url, null);
    }

    public static FetchException network(String url, Throwable cause) {
        return new FetchException(Kind.NETWORK, url, null,
                "Network error fetching " + url + ": " + cause.getMessage(), cause);
    }

    public boolean isRetryable() {
        if (kind != Kind.HTTP_ERROR) return true;
        return status != null && (status == 429 || status >= 500);
    }
}
