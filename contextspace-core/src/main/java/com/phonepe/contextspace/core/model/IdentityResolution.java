package com.phonepe.contextspace.core.model;

import lombok.Value;

/**
 * Outcome of identity resolution for one turn
 */
@Value
public class IdentityResolution {
    String pseudoUserId;
    double matchScore;
    boolean minted;

    public double linkConfidence() {
        return minted ? 1.0 : matchScore;
    }
}
