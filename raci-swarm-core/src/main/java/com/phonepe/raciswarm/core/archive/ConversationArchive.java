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

import java.util.Optional;

/**
 * Long term storage for closed conversations. Implementations must allow {@link #appendLate(MessageEnvelope)} to
 * race with {@link #archive(ArchivedConversation)} for the same conversation.
 */
public interface ConversationArchive {
    /**
     * Store a closed conversation. Late envelopes already recorded for it are kept.
     *
     * @return true if stored
     */
    boolean archive(ArchivedConversation conversation);

    /**
     * Record an envelope that arrived after the conversation was closed
     */
    boolean appendLate(MessageEnvelope envelope);

    Optional<ArchivedConversation> read(String conversationId);
}
