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

import com.phonepe.raciswarm.core.envelope.MessageEnvelope;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * An envelope was stamped and recorded in the conversation
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class EnvelopeDeliveredEvent extends SwarmEvent {
    MessageEnvelope envelope;

    @Builder
    @Jacksonized
    public EnvelopeDeliveredEvent(@NonNull String conversationId, @NonNull MessageEnvelope envelope) {
        super(SwarmEventType.ENVELOPE_DELIVERED, conversationId);
        this.envelope = envelope;
    }

    @Override
    public <T> T accept(SwarmEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
