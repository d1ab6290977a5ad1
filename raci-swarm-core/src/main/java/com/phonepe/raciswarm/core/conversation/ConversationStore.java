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

import java.util.List;
import java.util.Optional;

/**
 * Keeps conversations known to the orchestrator, live or closed
 */
public interface ConversationStore {
    Conversation save(Conversation conversation);

    Optional<Conversation> get(String conversationId);

    /**
     * @return Conversations started by the user, oldest first
     */
    List<Conversation> forUser(String userId);

    /**
     * @return Conversations not yet closed
     */
    List<Conversation> active();

    boolean remove(String conversationId);
}
