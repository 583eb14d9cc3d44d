package com.europeanalysis.stats;

/**
 * Base type for failures raised by the acquisition pipeline.
 */
public class StatsCrawlerException extends RuntimeException {

    public StatsCrawlerException(String message) {
        super(message);
    }

    public StatsCrawlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
