package com.phonepe.contextspace.core.store.memory;

import java.util.Comparator;

/**
 * A stored point with its similarity to a query. Ties are broken on id so results are stable.
 */
record ScoredPoint<T>(T point, String id, double score) {

    static <T> Comparator<ScoredPoint<T>> mostSimilarFirst() {
        return Comparator.<ScoredPoint<T>>comparingDouble(ScoredPoint::score)
                .reversed()
                .thenComparing(ScoredPoint::id);
    }
}
