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
import com.google.common.base.Strings;
import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.pipeline.SessionEnvelopeBuilder;

/**
 * Voice calls, already transcribed to text upstream
 */
public class PhoneAdapter implements NormalizingAdapter {
    @Override
    public Channel channel() {
        return Channel.PHONE;
    }

    @Override
    public ChannelMessage normalize(JsonNode raw) {
        final var transcript = RawFields.required(raw, "transcript");
        return ChannelMessage.builder()
                .channel(Channel.PHONE)
                .channelUserId(RawFields.required(raw, "phone_number"))
                .text(transcript)
                .summary(SessionEnvelopeBuilder.defaultSummary(transcript))
                .metadata(RawFields.metadata(raw, false))
                .build();
    }

    @Override
    public ObjectNode format(ChannelResponse response) {
        final var node = JsonNodeFactory.instance.objectNode();
        node.put("phone_number", response.getRecipient());
        node.put("response_text", Strings.isNullOrEmpty(response.getResponseText())
                                  ? "Call processed"
                                  : response.getResponseText());
        node.setAll(RawFields.outcome(response));
        return node;
    }
}
