package com.phonepe.contextspace.core.store;

import com.phonepe.contextspace.core.model.ShortTermVectorPoint;

import java.util.List;

/**
 * Nearest neighbour index over recent interactions. One point per session, the latest upsert wins.
 */
public interface ShortTermVectorIndex {
    void upsert(ShortTermVectorPoint point);

    /**
     * Points closest to the vector by cosine similarity on the intent vector, most similar first
     */
    List<ShortTermVectorPoint> nearest(float[] intentVector, int topK);
}
