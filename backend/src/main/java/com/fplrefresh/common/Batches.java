package com.fplrefresh.common;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a list into consecutive fixed-size chunks (last chunk may be shorter).
 */
public final class Batches {

    private Batches() {
    }

    public static <T> List<List<T>> of(List<T> items, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        List<List<T>> batches = new ArrayList<>();
        for (int i = 0; i < items.size(); i += batchSize) {
            batches.add(items.subList(i, Math.min(items.size(), i + batchSize)));
        }
        return batches;
    }
}
