package org.ionresults.datapipeline.parallel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a collection of work items into contiguous, independent partitions.
 */
public final class IonPartitions {

    private IonPartitions() {
        // Utility class
    }

    /**
     * Splits {@code items} into at most {@code partitionCount} partitions of near equal size.
     * Empty partitions are never produced; the concatenation of all partitions equals the input.
     *
     * @param items          items to split
     * @param partitionCount desired number of partitions, must be &gt;= 1
     * @return unmodifiable partitions in input order
     */
    public static <T> List<List<T>> partition(List<T> items, int partitionCount) {
        if (partitionCount < 1) {
            throw new IllegalArgumentException("partitionCount must be >= 1, got " + partitionCount);
        }
        if (items.isEmpty()) {
            return Collections.emptyList();
        }
        int count = Math.min(partitionCount, items.size());
        int base = items.size() / count;
        int remainder = items.size() % count;

        List<List<T>> partitions = new ArrayList<>(count);
        int from = 0;
        for (int i = 0; i < count; i++) {
            int size = base + (i < remainder ? 1 : 0);
            partitions.add(Collections.unmodifiableList(new ArrayList<>(items.subList(from, from + size))));
            from += size;
        }
        return Collections.unmodifiableList(partitions);
    }
}
