package com.nsqlexec.runner;

import java.util.ArrayList;
import java.util.List;

/**
 * Static assignment of work items to workers: item {@code i} goes to worker {@code i mod W}.
 * Every item lands in exactly one partition and each partition keeps the input order.
 */
public final class Partitioner {

    private Partitioner() {
    }

    public static <T> List<List<T>> partition(List<T> items, int workers) {
        if (workers <= 0) {
            throw new IllegalArgumentException("Worker count must be positive, got " + workers);
        }
        List<List<T>> partitions = new ArrayList<>(workers);
        for (int w = 0; w < workers; w++) {
            partitions.add(new ArrayList<>());
        }
        for (int i = 0; i < items.size(); i++) {
            partitions.get(i % workers).add(items.get(i));
        }
        return partitions;
    }
}
