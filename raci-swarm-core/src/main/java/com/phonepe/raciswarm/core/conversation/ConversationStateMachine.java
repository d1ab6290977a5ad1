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

import com.google.common.base.Preconditions;
import com.phonepe.raciswarm.core.envelope.EnvelopeKind;
import com.phonepe.raciswarm.core.envelope.MessageEnvelope;
import com.phonepe.raciswarm.core.errors.ErrorType;
import com.phonepe.raciswarm.core.errors.SwarmException;
import lombok.experimental.UtilityClass;

import java.util.Collection;
import java.util.Comparator;

/**
 * State transition rules. Every decision here depends only on the envelopes, in sequence order, so replaying a
 * conversation's envelopes always gives the same state no matter how they were delivered.
 */
@UtilityClass
public class ConversationStateMachine {

    /**
     * The only place {@code pending_user_reply} gets computed.
     *
     * @param kind                   Kind of the envelope being stamped
     * @param recipientId            Recipient of the envelope
     * @param initializerId          Id of the swarm's Responsible agent
     * @param delegationsOutstanding Whether any delegation in the current turn is still waiting for an answer
     * @return null for user requests, true for the hand-off back to the user, false otherwise
     */
    public static Boolean pendingUserReply(
            EnvelopeKind kind,
            String recipientId,
            String initializerId,
            boolean delegationsOutstanding) {
        if (kind == EnvelopeKind.USER_REQUEST) {
            return null;
        }
        return !kind.isDelegation()
                && recipientId.equals(initializerId)
                && !delegationsOutstanding;
    }

    /**
     * State after the given stamped envelope is delivered
     *
     * @param current  Current state, null for a conversation that has not seen any envelope yet
     * @param envelope Stamped envelope
     * @return Next state
     * @throws SwarmException with {@link ErrorType#INVALID_STATE_TRANSITION} if the envelope cannot arrive in the
     *                        current state
     */
    public static ConversationState next(ConversationState current, MessageEnvelope envelope) {
        if (current == ConversationState.CLOSED) {
            return ConversationState.CLOSED;
        }
        final var pending = envelope.getPendingUserReply();
        final ConversationState target;
        final boolean allowed;
        if (null == pending) {
            target = ConversationState.OPEN;
            allowed = current == null || current == ConversationState.AWAITING_USER;
        }
        else if (pending) {
            target = ConversationState.AWAITING_USER;
            allowed = current == ConversationState.OPEN || current == ConversationState.DELEGATING;
        }
        else {
            target = ConversationState.DELEGATING;
            allowed = current == ConversationState.OPEN || current == ConversationState.DELEGATING;
        }
        if (!allowed) {
            throw new SwarmException(ErrorType.INVALID_STATE_TRANSITION,
                                     envelope.getConversationId(), current, target);
        }
        return target;
    }

    /**
     * Rebuilds the state from a set of envelopes, in whatever order they are provided
     */
    public static ConversationState replay(Collection<MessageEnvelope> envelopes) {
        Preconditions.checkArgument(!envelopes.isEmpty(), "Need at least one envelope to replay");
        return envelopes.stream()
                .sorted(Comparator.comparingLong(MessageEnvelope::getSequenceNo))
                .reduce((ConversationState) null,
                        ConversationStateMachine::next,
                        (lhs, rhs) -> rhs);
    }
}
