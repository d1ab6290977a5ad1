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

import com.phonepe.raciswarm.core.conversation.ConversationState;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A conversation moved between states. {@code fromState} is null for a brand-new conversation.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class StateTransitionEvent extends SwarmEvent {
    ConversationState fromState;
    ConversationState toState;
    long sequenceNo;

    @Builder
    @Jacksonized
    public StateTransitionEvent(
            @NonNull String conversationId,
            ConversationState fromState,
            @NonNull ConversationState toState,
            long sequenceNo) {
        super(SwarmEventType.STATE_TRANSITION, conversationId);
        this.fromState = fromState;
        this.toState = toState;
        this.sequenceNo = sequenceNo;
    }

    @Override
    public <T> T accept(SwarmEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
