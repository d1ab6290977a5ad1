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

package com.phonepe.raciswarm.core.utils;

import com.google.common.base.Strings;
import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Small helpers used across the orchestration code
 */
@UtilityClass
public class SwarmUtils {
    public static final String USER_SENDER_PREFIX = "user:";

    public static long epochMicro() {
        return ChronoUnit.MICROS.between(Instant.EPOCH, Instant.now());
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Conversation ids are prefixed with the user id, same as the ids handed out to the UI layer
     */
    public static String conversationId(String userId) {
        return "%s_%s".formatted(userId, newId());
    }

    public static String userSender(String userId) {
        return USER_SENDER_PREFIX + userId;
    }

    public static String abbreviate(String text, int maxLength) {
        final var value = Strings.nullToEmpty(text);
        if (maxLength <= 0) {
            return "";
        }
        if (value.length() <= maxLength) {
            return value;
        }
        if (maxLength <= 3) {
            return value.substring(0, maxLength);
        }
        return value.substring(0, maxLength - 3) + "...";
    }
}
