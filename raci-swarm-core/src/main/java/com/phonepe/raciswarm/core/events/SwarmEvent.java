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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.phonepe.raciswarm.core.utils.SwarmUtils;
import lombok.AccessLevel;
import lombok.Data;
import lombok.RequiredArgsConstructor;

/**
 * Base class for everything published on the {@link EventBus}
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(name = SwarmEventType.Values.STATE_TRANSITION, value = StateTransitionEvent.class),
        @JsonSubTypes.Type(name = SwarmEventType.Values.ENVELOPE_DELIVERED, value = EnvelopeDeliveredEvent.class),
        @JsonSubTypes.Type(name = SwarmEventType.Values.HOP_FAILED, value = HopFailedEvent.class),
        @JsonSubTypes.Type(name = SwarmEventType.Values.MEMORY_COMPACTED, value = MemoryCompactedEvent.class),
})
@Data
@RequiredArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class SwarmEvent {
    private final SwarmEventType type;
    private final String eventId = SwarmUtils.newId();
    private final String conversationId;
    private final long timestamp = SwarmUtils.epochMicro();

    public abstract <T> T accept(final SwarmEventVisitor<T> visitor);
}
