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

import com.phonepe.contextspace.core.model.Channel;
import lombok.experimental.UtilityClass;

import java.util.EnumMap;
import java.util.Map;

/**
 * Picks the adapter for a channel
 */
@UtilityClass
public class NormalizingAdapters {
    private static final Map<Channel, NormalizingAdapter> ADAPTERS = adapters();

    public static NormalizingAdapter forChannel(Channel channel) {
        return ADAPTERS.get(channel);
    }

    private static Map<Channel, NormalizingAdapter> adapters() {
        final var adapters = new EnumMap<Channel, NormalizingAdapter>(Channel.class);
        adapters.put(Channel.WEB, new WebAdapter());
        adapters.put(Channel.WHATSAPP, new WhatsAppAdapter());
        adapters.put(Channel.X, new XAdapter());
        adapters.put(Channel.EMAIL, new EmailAdapter());
        adapters.put(Channel.PHONE, new PhoneAdapter());
        return adapters;
    }
}
