package com.phonepe.contextspace.storage.identity;

import com.phonepe.contextspace.core.model.LinkedSession;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.FieldNameConstants;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@FieldNameConstants
@Builder
@Jacksonized
public class ESIdentityMapDocument {
    String pseudoUserId;

    List<LinkedSession> linkedSessions;

    long updatedAt;
}
