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

package com.phonepe.raciswarm.core.conversation;

import com.phonepe.raciswarm.core.envelope.MessageEnvelope;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;

/**
 * Read only copy of a conversation, safe to hand out to callers
 */
@Value
@Builder
@Jacksonized
public class ConversationView {
    String conversationId;
    String userId;
    String swarmName;
    ConversationState state;
    int turn;
    /**
     * Agent to agent hops taken in the current turn
     */
    int hops;
    List<MessageEnvelope> envelopes;
    long createdAt;
    long lastActivityAt;

    /**
     * The envelope that handed the latest turn back to the user, if there is one
     */
    public Optional<MessageEnvelope> terminalEnvelope() {
        return envelopes.stream()
                .filter(envelope -> envelope.getTurn() == turn)
                .filter(MessageEnvelope::isTerminal)
                .findFirst();
    }
}
