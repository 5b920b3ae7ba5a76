package com.phonepe.contextspace.core.store.memory;

import com.phonepe.contextspace.core.model.ShortTermVectorPoint;
import com.phonepe.contextspace.core.store.ShortTermVectorIndex;
import com.phonepe.contextspace.core.utils.VectorMath;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryShortTermVectorIndex implements ShortTermVectorIndex {
    private final Map<String, ShortTermVectorPoint> points = new ConcurrentHashMap<>();

    @Override
    public void upsert(ShortTermVectorPoint point) {
        points.put(point.getSessionId(), point);
    }

    @Override
    public List<ShortTermVectorPoint> nearest(float[] intentVector, int topK) {
        return points.values()
                .stream()
                .map(point -> new ScoredPoint<>(point, point.getSessionId(),
                                                VectorMath.cosineSimilarity(intentVector, point.getIntentVector())))
                .sorted(ScoredPoint.<ShortTermVectorPoint>mostSimilarFirst())
                .limit(topK)
                .map(ScoredPoint::point)
                .toList();
    }
}
