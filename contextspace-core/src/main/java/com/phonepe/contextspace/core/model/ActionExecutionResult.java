package com.phonepe.contextspace.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class ActionExecutionResult {
    String actionId;
    boolean success;
    String message;
    long executedAt;
    Map<String, String> data;
}
