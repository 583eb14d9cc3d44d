package com.europeanalysis.stats;

import lombok.Getter;

/**
 * Upstream failure: non-transient HTTP status, retries exhausted, a page
 * that could not be parsed or a local extract that could not be read.
 *
 * {@code status} is null when no HTTP response was received (timeouts,
 * connection resets, malformed URLs, unparseable bodies, unreadable files).
 */
@Getter
public class SourceException extends StatsCrawlerException {

    private final Integer status;
    private final String uri;

    public SourceException(String message, Integer status, String uri) {
        super(message);
        this.status = status;
        this.uri = uri;
    }

    public SourceException(String message, Integer status, String uri, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.uri = uri;
    }
}
