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
 * Inbound email. The subject, if any, leads the text and doubles as the summary.
 */
public class EmailAdapter implements NormalizingAdapter {
    public static final String REPLY_SUBJECT = "Re: Your inquiry";

    @Override
    public Channel channel() {
        return Channel.EMAIL;
    }

    @Override
    public ChannelMessage normalize(JsonNode raw) {
        final var from = RawFields.required(raw, "from");
        final var body = RawFields.required(raw, "message");
        final var subject = RawFields.optional(raw, "subject");
        final var hasSubject = !Strings.isNullOrEmpty(subject) && !subject.isBlank();
        return ChannelMessage.builder()
                .channel(Channel.EMAIL)
                .channelUserId(from)
                .text(hasSubject ? subject + "\n\n" + body : body)
                .summary(hasSubject ? subject : SessionEnvelopeBuilder.defaultSummary(body))
                .metadata(RawFields.metadata(raw, true))
                .build();
    }

    @Override
    public ObjectNode format(ChannelResponse response) {
        final var node = JsonNodeFactory.instance.objectNode();
        node.put("to", response.getRecipient());
        node.put("subject", REPLY_SUBJECT);
        node.put("message", Strings.isNullOrEmpty(response.getResponseText())
                            ? "Email processed"
                            : response.getResponseText());
        node.setAll(RawFields.outcome(response));
        return node;
    }
}
