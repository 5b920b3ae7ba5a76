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
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phonepe.contextspace.core.errors.ContextSpaceError;
import com.phonepe.contextspace.core.model.Channel;
import com.phonepe.contextspace.core.pipeline.MemoryPipeline;
import com.phonepe.contextspace.core.pipeline.RetrievalResult;
import com.phonepe.contextspace.core.pipeline.SessionEnvelopeBuilder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for channel integrations: raw payload in, channel formatted reply out.
 * Failures never escape; they are rendered as an unsuccessful reply.
 */
@Slf4j
public class ChannelGateway {
    private final MemoryPipeline pipeline;
    private final SessionEnvelopeBuilder envelopeBuilder;

    public ChannelGateway(MemoryPipeline pipeline, SessionEnvelopeBuilder envelopeBuilder) {
        this.pipeline = pipeline;
        this.envelopeBuilder = envelopeBuilder;
    }

    public ObjectNode handle(@NonNull Channel channel, JsonNode raw) {
        final var adapter = NormalizingAdapters.forChannel(channel);
        String recipient = null;
        try {
            final var message = adapter.normalize(raw);
            recipient = message.getChannelUserId();
            final var envelope = envelopeBuilder.build(message.getChannel(),
                                                       message.getChannelUserId(),
                                                       message.getRole(),
                                                       message.getText(),
                                                       message.getSummary(),
                                                       message.getMetadata());
            final var result = pipeline.store(envelope);
            return adapter.format(ChannelResponse.stored(recipient, result));
        }
        catch (Exception e) {
            final var error = ContextSpaceError.from(e);
            log.error("Failed to handle {} message. Error code: {}", channel, error.getCode(), e);
            return adapter.format(ChannelResponse.failed(recipient, error));
        }
    }

    /**
     * Memory for a channel user, addressed by their raw id
     */
    public RetrievalResult retrieve(Channel channel, String rawChannelUserId, String queryText) {
        return pipeline.retrieve(envelopeBuilder.sessionId(channel, rawChannelUserId), queryText);
    }
}
