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

package com.phonepe.raciswarm.core.archive;

import com.phonepe.raciswarm.core.envelope.MessageEnvelope;
import com.phonepe.raciswarm.core.memory.MemorySnapshot;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;

/**
 * A closed conversation: full envelope history, the last memory snapshot and anything that came in after closing
 */
@Value
@With
public class ArchivedConversation {
    String conversationId;
    String userId;
    String swarmName;
    int turns;
    List<MessageEnvelope> envelopes;
    MemorySnapshot snapshot;
    List<MessageEnvelope> lateEnvelopes;
    long closedAt;

    @Builder
    @Jacksonized
    public ArchivedConversation(
            String conversationId,
            String userId,
            String swarmName,
            int turns,
            List<MessageEnvelope> envelopes,
            MemorySnapshot snapshot,
            List<MessageEnvelope> lateEnvelopes,
            long closedAt) {
        this.conversationId = conversationId;
        this.userId = userId;
        this.swarmName = swarmName;
        this.turns = turns;
        this.envelopes = List.copyOf(Objects.requireNonNullElse(envelopes, List.of()));
        this.snapshot = snapshot;
        this.lateEnvelopes = List.copyOf(Objects.requireNonNullElse(lateEnvelopes, List.of()));
        this.closedAt = closedAt;
    }
}
