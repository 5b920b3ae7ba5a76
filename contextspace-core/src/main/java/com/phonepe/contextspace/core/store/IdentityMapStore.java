package com.phonepe.contextspace.core.store;

import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.model.IdentityMapEntry;
import com.phonepe.contextspace.core.model.LinkedSession;

import java.util.List;
import java.util.Optional;

/**
 * Persistent mapping of pseudo users to the channel identities linked to them.
 * <p>
 * A (channel, hashed id) pair belongs to at most one pseudo user and confidences never go down.
 */
public interface IdentityMapStore {
    Optional<IdentityMapEntry> findByPseudoUserId(String pseudoUserId);

    Optional<IdentityMapEntry> findByLinkedSession(Channel channel, String hashedChannelUserId);

    /**
     * Atomically links the session to the pseudo user. If the session is already linked to a different
     * pseudo user, nothing is changed and the entry owning the session is returned.
     *
     * @return The entry the session is linked to after the call
     */
    IdentityMapEntry link(String pseudoUserId, LinkedSession session);

    List<String> pseudoUserIds(int limit);

    long count();
}
