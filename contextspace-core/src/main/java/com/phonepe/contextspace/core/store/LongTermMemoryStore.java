package com.phonepe.contextspace.core.store;

import com.phonepe.contextspace.core.model.LongTermMemoryPoint;

import java.util.List;

/**
 * Persistent archive of interaction summaries. Append only.
 */
public interface LongTermMemoryStore {
    /**
     * Inserts a new point. Fails if a point with the same id already exists.
     */
    void insert(LongTermMemoryPoint point);

    List<LongTermMemoryPoint> nearest(float[] intentVector, int topK);
}
