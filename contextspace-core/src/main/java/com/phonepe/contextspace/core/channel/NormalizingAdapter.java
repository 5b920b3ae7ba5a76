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
import com.phonepe.contextspace.core.errors.ValidationException;
import com.phonepe.contextspace.core.model.Channel;

/**
 * Translates between a channel's wire format and the canonical message
 */
public interface NormalizingAdapter {
    Channel channel();

    /**
     * @throws ValidationException if a mandatory field is missing or blank
     */
    ChannelMessage normalize(JsonNode raw);

    ObjectNode format(ChannelResponse response);
}
