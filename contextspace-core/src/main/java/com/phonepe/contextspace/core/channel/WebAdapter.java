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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.pipeline.SessionEnvelopeBuilder;

/**
 * Browser chat widget. Users are identified by their session cookie.
 */
public class WebAdapter implements NormalizingAdapter {
    @Override
    public Channel channel() {
        return Channel.WEB;
    }

    @Override
    public ChannelMessage normalize(JsonNode raw) {
        final var text = RawFields.required(raw, "message");
        return ChannelMessage.builder()
                .channel(Channel.WEB)
                .channelUserId(RawFields.required(raw, "session_cookie"))
                .text(text)
                .summary(SessionEnvelopeBuilder.defaultSummary(text))
                .metadata(RawFields.metadata(raw, true))
                .build();
    }

    @Override
    public ObjectNode format(ChannelResponse response) {
        final var node = JsonNodeFactory.instance.objectNode();
        node.put("success", response.isSuccess());
        if (response.getSessionId() != null) {
            node.put("session_id", response.getSessionId());
        }
        node.setAll(RawFields.outcome(response));
        final var actions = node.putArray("recommended_actions");
        response.getRecommendedActions().forEach(action -> actions.add(RawFields.action(action)));
        return node;
    }
}
