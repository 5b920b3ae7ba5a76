package com.phonepe.contextspace.core.store;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Handles to all backing stores. Built once by the application and passed to the components that need them.
 */
@Value
@Builder
public class MemoryStores {
    @NonNull
    SessionCache sessionCache;

    @NonNull
    ShortTermVectorIndex shortTermVectors;

    @NonNull
    LongTermMemoryStore longTermMemory;

    @NonNull
    IdentityMapStore identityMap;

    @NonNull
    EscalationTicketStore escalations;
}
