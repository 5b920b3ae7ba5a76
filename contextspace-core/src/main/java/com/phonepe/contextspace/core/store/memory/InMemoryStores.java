package com.phonepe.contextspace.core.store.memory;

import com.phonepe.contextspace.core.store.MemoryStores;
import lombok.experimental.UtilityClass;

import java.time.Clock;

/**
 * Wires a {@link MemoryStores} entirely out of in-memory stores
 */
@UtilityClass
public class InMemoryStores {

    public static MemoryStores create() {
        return create(Clock.systemUTC());
    }

    public static MemoryStores create(Clock clock) {
        return MemoryStores.builder()
                .sessionCache(new InMemorySessionCache(clock))
                .shortTermVectors(new InMemoryShortTermVectorIndex())
                .longTermMemory(new InMemoryLongTermMemoryStore())
                .identityMap(new InMemoryIdentityMapStore(clock))
                .escalations(new InMemoryEscalationTicketStore())
                .build();
    }
}
