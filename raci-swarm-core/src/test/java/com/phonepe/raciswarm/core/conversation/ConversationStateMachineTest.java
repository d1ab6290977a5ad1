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

import com.phonepe.raciswarm.core.errors.ErrorType;
import com.phonepe.raciswarm.core.errors.SwarmException;
import com.phonepe.raciswarm.core.envelope.EnvelopeKind;
import com.phonepe.raciswarm.core.envelope.MessageEnvelope;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.phonepe.raciswarm.core.TestAgents.ADMIN;
import static com.phonepe.raciswarm.core.TestAgents.CONSULTED;
import static com.phonepe.raciswarm.core.TestAgents.INITIALIZER;
import static com.phonepe.raciswarm.core.TestAgents.envelope;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationStateMachineTest {

    @Test
    void testPendingUserReplyDerivation() {
        assertNull(ConversationStateMachine.pendingUserReply(EnvelopeKind.USER_REQUEST, INITIALIZER, INITIALIZER,
                                                             false));
        assertFalse(ConversationStateMachine.pendingUserReply(EnvelopeKind.DELEGATION, ADMIN, INITIALIZER, false));
        assertFalse(ConversationStateMachine.pendingUserReply(EnvelopeKind.ANSWER, ADMIN, INITIALIZER, false));
        assertTrue(ConversationStateMachine.pendingUserReply(EnvelopeKind.ANSWER, INITIALIZER, INITIALIZER, false));
        assertTrue(ConversationStateMachine.pendingUserReply(EnvelopeKind.FALLBACK, INITIALIZER, INITIALIZER, false));
        //Still waiting on someone, not done yet
        assertFalse(ConversationStateMachine.pendingUserReply(EnvelopeKind.ANSWER, INITIALIZER, INITIALIZER, true));
        assertFalse(ConversationStateMachine.pendingUserReply(EnvelopeKind.DELEGATION, INITIALIZER, INITIALIZER,
                                                              false));
    }

    @Test
    void testTransitions() {
        var state = ConversationStateMachine.next(null, envelope(1, "user:u", INITIALIZER, null));
        assertEquals(ConversationState.OPEN, state);
        state = ConversationStateMachine.next(state, envelope(2, INITIALIZER, ADMIN, false));
        assertEquals(ConversationState.DELEGATING, state);
        state = ConversationStateMachine.next(state, envelope(3, ADMIN, CONSULTED, false));
        assertEquals(ConversationState.DELEGATING, state);
        state = ConversationStateMachine.next(state, envelope(4, ADMIN, INITIALIZER, true));
        assertEquals(ConversationState.AWAITING_USER, state);
        state = ConversationStateMachine.next(state, envelope(5, "user:u", INITIALIZER, null));
        assertEquals(ConversationState.OPEN, state);
    }

    @Test
    void testInvalidTransitions() {
        final var delegating = envelope(2, INITIALIZER, ADMIN, false);
        var error = assertThrows(SwarmException.class, () -> ConversationStateMachine.next(null, delegating));
        assertEquals(ErrorType.INVALID_STATE_TRANSITION, error.getErrorType());

        final var userRequest = envelope(3, "user:u", INITIALIZER, null);
        error = assertThrows(SwarmException.class,
                             () -> ConversationStateMachine.next(ConversationState.DELEGATING, userRequest));
        assertEquals(ErrorType.INVALID_STATE_TRANSITION, error.getErrorType());

        final var terminal = envelope(4, ADMIN, INITIALIZER, true);
        assertThrows(SwarmException.class,
                     () -> ConversationStateMachine.next(ConversationState.AWAITING_USER, terminal));
    }

    @Test
    void testClosedStaysClosed() {
        assertEquals(ConversationState.CLOSED,
                     ConversationStateMachine.next(ConversationState.CLOSED, envelope(9, ADMIN, INITIALIZER, true)));
        assertEquals(ConversationState.CLOSED,
                     ConversationStateMachine.next(ConversationState.CLOSED, envelope(10, "user:u", INITIALIZER,
                                                                                       null)));
    }

    @Test
    void testReplayDoesNotDependOnDeliveryOrder() {
        final var envelopes = List.of(
                envelope(1, "user:u", INITIALIZER, null),
                envelope(2, INITIALIZER, ADMIN, false),
                envelope(3, ADMIN, CONSULTED, false),
                envelope(4, CONSULTED, ADMIN, false),
                envelope(5, ADMIN, INITIALIZER, true),
                envelope(6, "user:u", INITIALIZER, null),
                envelope(7, INITIALIZER, ADMIN, false));
        final var expected = ConversationStateMachine.replay(envelopes);
        assertEquals(ConversationState.DELEGATING, expected);

        final var random = new Random(42);
        for (int i = 0; i < 20; i++) {
            final var shuffled = new ArrayList<MessageEnvelope>(envelopes);
            Collections.shuffle(shuffled, random);
            assertEquals(expected, ConversationStateMachine.replay(shuffled));
        }
        assertEquals(ConversationState.AWAITING_USER, ConversationStateMachine.replay(envelopes.subList(0, 5)));
    }
}
