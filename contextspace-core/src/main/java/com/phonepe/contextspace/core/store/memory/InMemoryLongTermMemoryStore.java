package com.phonepe.contextspace.core.store.memory;

import com.phonepe.contextspace.core.errors.DuplicateMemoryPointException;
import com.phonepe.contextspace.core.model.LongTermMemoryPoint;
import com.phonepe.contextspace.core.store.LongTermMemoryStore;
import com.phonepe.contextspace.core.utils.VectorMath;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryLongTermMemoryStore implements LongTermMemoryStore {
    private final Map<String, LongTermMemoryPoint> points = new ConcurrentHashMap<>();

    @Override
    public void insert(LongTermMemoryPoint point) {
        if (points.putIfAbsent(point.id(), point) != null) {
            throw new DuplicateMemoryPointException(point.id());
        }
    }

    @Override
    public List<LongTermMemoryPoint> nearest(float[] intentVector, int topK) {
        return points.values()
                .stream()
                .map(point -> new ScoredPoint<>(point, point.id(),
                                                VectorMath.cosineSimilarity(intentVector, point.getIntentVector())))
                .sorted(ScoredPoint.<LongTermMemoryPoint>mostSimilarFirst())
                .limit(topK)
                .map(ScoredPoint::point)
                .toList();
    }
}
