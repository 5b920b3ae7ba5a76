/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.contextspace.core.channel;

import com.phonepe.contextspace.core.errors.ContextSpaceError;
import com.phonepe.contextspace.core.model.RecommendedAction;
import com.phonepe.contextspace.core.model.UrgencyLevel;
import com.phonepe.contextspace.core.pipeline.StoreResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Channel neutral outcome of handling an inbound message
 */
@Value
@Builder
public class ChannelResponse {
    boolean success;
    String recipient;
    String sessionId;
    String pseudoUserId;
    String responseText;
    UrgencyLevel urgency;
    boolean escalated;

    @Builder.Default
    List<RecommendedAction> recommendedActions = List.of();

    ContextSpaceError error;

    public static ChannelResponse stored(String recipient, StoreResult result) {
        return ChannelResponse.builder()
                .success(true)
                .recipient(recipient)
                .sessionId(result.getSessionId())
                .pseudoUserId(result.getPseudoUserId())
                .urgency(result.getUrgency().getLevel())
                .escalated(result.isEscalated())
                .recommendedActions(result.getRecommendedActions())
                .build();
    }

    public static ChannelResponse failed(String recipient, ContextSpaceError error) {
        return ChannelResponse.builder()
                .success(false)
                .recipient(recipient)
                .error(error)
                .build();
    }
}
