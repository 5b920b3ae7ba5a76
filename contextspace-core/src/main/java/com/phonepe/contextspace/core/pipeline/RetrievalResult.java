package com.phonepe.contextspace.core.pipeline;

import com.phonepe.contextspace.core.model.LongTermMemoryPoint;
import com.phonepe.contextspace.core.model.ShortTermRecord;
import com.phonepe.contextspace.core.model.ShortTermVectorPoint;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Memory assembled for a query. Reading never changes any store.
 */
@Value
@Builder
@Jacksonized
public class RetrievalResult {
    String memoryBlock;

    /**
     * Null if the session has no live state
     */
    ShortTermRecord shortTerm;

    @Builder.Default
    List<ShortTermVectorPoint> similarSessions = List.of();

    @Builder.Default
    List<LongTermMemoryPoint> longTerm = List.of();

    long retrievedAt;
}
