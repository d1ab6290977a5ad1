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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps archived conversations in memory. Mostly useful for tests and short-lived processes.
 */
public class InMemoryConversationArchive implements ConversationArchive {
    private final Map<String, ArchivedConversation> archived = new ConcurrentHashMap<>();
    private final Map<String, List<MessageEnvelope>> late = new ConcurrentHashMap<>();

    @Override
    public boolean archive(ArchivedConversation conversation) {
        archived.put(conversation.getConversationId(), conversation);
        return true;
    }

    @Override
    public boolean appendLate(MessageEnvelope envelope) {
        late.compute(envelope.getConversationId(), (id, existing) -> {
            final var envelopes = null == existing ? new ArrayList<MessageEnvelope>() : existing;
            envelopes.add(envelope);
            return envelopes;
        });
        return true;
    }

    @Override
    public Optional<ArchivedConversation> read(String conversationId) {
        final var conversation = archived.get(conversationId);
        if (null == conversation) {
            return Optional.empty();
        }
        final var lateEnvelopes = new ArrayList<>(conversation.getLateEnvelopes());
        late.computeIfPresent(conversationId, (id, envelopes) -> {
            lateEnvelopes.addAll(envelopes);
            return envelopes;
        });
        return Optional.of(conversation.withLateEnvelopes(lateEnvelopes));
    }
}
