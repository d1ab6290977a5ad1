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

package com.phonepe.raciswarm.core.envelope;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phonepe.raciswarm.core.errors.ErrorType;
import com.phonepe.raciswarm.core.utils.SwarmUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * The unit exchanged between agents. Envelopes are immutable; the orchestrator creates a stamped copy before the
 * envelope is delivered and never touches it afterwards.
 * <p>
 * {@code pendingUserReply} is a tri-state:
 * <ul>
 *     <li>{@code null}: the envelope came from the user</li>
 *     <li>{@code false}: internal agent to agent traffic</li>
 *     <li>{@code true}: the terminal hand-off back to the user</li>
 * </ul>
 * Field names on the wire are snake_case for downstream consumers.
 */
@Value
@With
@Builder
@Jacksonized
public class MessageEnvelope {
    @JsonProperty("envelope_id")
    @Builder.Default
    String envelopeId = SwarmUtils.newId();

    @NonNull
    @JsonProperty("conversation_id")
    String conversationId;

    @NonNull
    @JsonProperty("sender_id")
    String senderId;

    @NonNull
    @JsonProperty("recipient_id")
    String recipientId;

    @NonNull
    @JsonProperty("kind")
    EnvelopeKind kind;

    @JsonProperty("content")
    @Builder.Default
    String content = "";

    @JsonProperty("pending_user_reply")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    Boolean pendingUserReply;

    @JsonProperty("sequence_no")
    long sequenceNo;

    /**
     * Agent to agent step number inside the turn. Zero for the user request.
     */
    @JsonProperty("hop")
    int hop;

    @JsonProperty("turn")
    int turn;

    /**
     * Sequence number of the envelope this one responds to. Zero when it does not answer anything.
     */
    @JsonProperty("reply_to")
    long replyTo;

    @JsonProperty("error_type")
    ErrorType errorType;

    @JsonProperty("timestamp")
    @Builder.Default
    long timestamp = SwarmUtils.epochMicro();

    @JsonIgnore
    public boolean isTerminal() {
        return Boolean.TRUE.equals(pendingUserReply);
    }

    @JsonIgnore
    public boolean isFromUser() {
        return kind == EnvelopeKind.USER_REQUEST;
    }
}
