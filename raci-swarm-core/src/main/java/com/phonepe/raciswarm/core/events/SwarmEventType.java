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

package com.phonepe.raciswarm.core.events;

import lombok.Getter;
import lombok.experimental.UtilityClass;

/**
 * Types of events raised while a conversation is driven
 */
@Getter
public enum SwarmEventType {
    STATE_TRANSITION(Values.STATE_TRANSITION),
    ENVELOPE_DELIVERED(Values.ENVELOPE_DELIVERED),
    HOP_FAILED(Values.HOP_FAILED),
    MEMORY_COMPACTED(Values.MEMORY_COMPACTED),
    ;

    private final String type;

    SwarmEventType(String type) {
        this.type = type;
    }

    @UtilityClass
    public static final class Values {
        public static final String STATE_TRANSITION = "STATE_TRANSITION";
        public static final String ENVELOPE_DELIVERED = "ENVELOPE_DELIVERED";
        public static final String HOP_FAILED = "HOP_FAILED";
        public static final String MEMORY_COMPACTED = "MEMORY_COMPACTED";
    }
}
