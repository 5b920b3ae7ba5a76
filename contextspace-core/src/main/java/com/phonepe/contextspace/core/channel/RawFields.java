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
import com.phonepe.contextspace.core.errors.ValidationException;
import com.phonepe.contextspace.core.model.RecommendedAction;
import com.phonepe.contextspace.core.model.SessionMetadata;
import lombok.experimental.UtilityClass;

/**
 * Field access helpers shared by the channel adapters
 */
@UtilityClass
class RawFields {

    static String required(JsonNode raw, String field) {
        final var value = optional(raw, field);
        if (value == null || value.isBlank()) {
            throw ValidationException.blank(field);
        }
        return value;
    }

    static String optional(JsonNode raw, String field) {
        if (raw == null || !raw.hasNonNull(field) || !raw.get(field).isValueNode()) {
            return null;
        }
        return raw.get(field).asText();
    }

    /**
     * Reads the nested metadata object. Connection details (ip, user agent) are only trusted where asked for.
     */
    static SessionMetadata metadata(JsonNode raw, boolean includeConnection) {
        final var node = raw == null ? null : raw.get("metadata");
        if (node == null || !node.isObject()) {
            return SessionMetadata.EMPTY;
        }
        final var builder = SessionMetadata.builder()
                .geo(optional(node, "geo"))
                .lang(optional(node, "lang"));
        if (includeConnection) {
            builder.ip(optional(node, "ip"))
                    .userAgent(optional(node, "user_agent"));
        }
        return builder.build();
    }

    static ObjectNode outcome(ChannelResponse response) {
        final var node = JsonNodeFactory.instance.objectNode();
        if (response.getUrgency() != null) {
            node.put("urgency", response.getUrgency().wireName());
        }
        node.put("escalated", response.isEscalated());
        if (!response.isSuccess() && response.getError() != null) {
            final var error = response.getError();
            node.put("error", error.getMessage());
            if (error.getCode() != null) {
                node.put("code", error.getCode().name());
            }
            if (error.getField() != null) {
                node.put("field", error.getField());
            }
        }
        return node;
    }

    static ObjectNode action(RecommendedAction action) {
        final var node = JsonNodeFactory.instance.objectNode();
        node.put("type", action.getType().wireName());
        node.put("description", action.getDescription());
        node.put("priority", action.getPriority());
        node.put("can_auto_execute", action.isCanAutoExecute());
        return node;
    }
}
