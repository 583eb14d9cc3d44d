package com.europeanalysis.stats.model;

public record UpsertResult(int inserted, int updated) {

    public static final UpsertResult EMPTY = new UpsertResult(0, 0);

    public int total() {
        return inserted + updated;
    }
}
