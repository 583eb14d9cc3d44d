package com.europeanalysis.stats.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One fair lock per dataset id. Runs of the same dataset queue on it in
 * arrival order; different datasets never contend.
 */
@Component
public class DatasetLocks {

    private final ConcurrentHashMap<String, Lock> locks = new ConcurrentHashMap<>();

    public Lock lockFor(String datasetId) {
        return locks.computeIfAbsent(datasetId, id -> new ReentrantLock(true));
    }
}
