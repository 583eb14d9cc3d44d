package com.europeanalysis.stats;

/**
 * A natural-key invariant was violated while writing facts. Never retried.
 */
public class RepositoryConflictException extends StatsCrawlerException {

    public RepositoryConflictException(String message) {
        super(message);
    }

    public RepositoryConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
