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

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Conversation store backed by a concurrent map
 */
public class InMemoryConversationStore implements ConversationStore {
    private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();

    @Override
    public Conversation save(Conversation conversation) {
        conversations.put(conversation.getId(), conversation);
        return conversation;
    }

    @Override
    public Optional<Conversation> get(String conversationId) {
        return Optional.ofNullable(conversations.get(conversationId));
    }

    @Override
    public List<Conversation> forUser(String userId) {
        return conversations.values()
                .stream()
                .filter(conversation -> conversation.getUserId().equals(userId))
                .sorted(Comparator.comparingLong(Conversation::getCreatedAt))
                .toList();
    }

    @Override
    public List<Conversation> active() {
        return conversations.values()
                .stream()
                .filter(conversation -> !conversation.isClosed())
                .toList();
    }

    @Override
    public boolean remove(String conversationId) {
        return conversations.remove(conversationId) != null;
    }
}
