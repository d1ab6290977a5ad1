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
import com.phonepe.raciswarm.core.routing.ResolvedSwarm;
import com.phonepe.raciswarm.core.utils.SwarmUtils;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A live conversation. Only the thread holding {@link #turnLock()} drives envelopes through it. State and history are
 * guarded by the instance monitor so that {@link #close()} and read-only views can run from other threads.
 */
public class Conversation {
    @Getter
    private final String id;
    @Getter
    private final String userId;
    @Getter
    private final ResolvedSwarm swarm;
    @Getter
    private final long createdAt;
    @Getter
    private final DelegationTracker tracker = new DelegationTracker();
    @Getter
    private final ConversationInbox inbox = new ConversationInbox();

    private final Lock turnLock = new ReentrantLock();
    private final AtomicLong sequence = new AtomicLong();
    private final List<MessageEnvelope> envelopes = new ArrayList<>();
    private ConversationState state;
    private int turn;
    private int hops;
    private volatile long lastActivityAt;

    public Conversation(String id, String userId, ResolvedSwarm swarm) {
        this.id = id;
        this.userId = userId;
        this.swarm = swarm;
        this.createdAt = SwarmUtils.epochMicro();
        this.lastActivityAt = createdAt;
    }

    public Lock turnLock() {
        return turnLock;
    }

    public String getSwarmName() {
        return swarm.getName();
    }

    public String initializerId() {
        return swarm.getInitializer().id();
    }

    public String adminId() {
        return swarm.getAdmin().id();
    }

    public long nextSequenceNo() {
        return sequence.incrementAndGet();
    }

    /**
     * Start a new user turn. Resets the hop count and any leftover delegation state.
     *
     * @return The new turn number
     */
    public synchronized int startTurn() {
        turn++;
        hops = 0;
        tracker.clear();
        inbox.clear();
        return turn;
    }

    public synchronized int currentTurn() {
        return turn;
    }

    public synchronized int nextHop() {
        return ++hops;
    }

    public synchronized int hops() {
        return hops;
    }

    public synchronized ConversationState state() {
        return state;
    }

    public synchronized boolean isClosed() {
        return state == ConversationState.CLOSED;
    }

    /**
     * Record a stamped envelope and move the state machine
     *
     * @return The transition, empty if the conversation is closed and the envelope was not recorded
     */
    public synchronized Optional<StateTransition> apply(MessageEnvelope envelope) {
        if (state == ConversationState.CLOSED) {
            return Optional.empty();
        }
        final var from = state;
        state = ConversationStateMachine.next(from, envelope);
        envelopes.add(envelope);
        lastActivityAt = SwarmUtils.epochMicro();
        return Optional.of(new StateTransition(from, state, envelope.getSequenceNo()));
    }

    /**
     * @return The transition, empty if the conversation was already closed
     */
    public synchronized Optional<StateTransition> close() {
        if (state == ConversationState.CLOSED) {
            return Optional.empty();
        }
        final var from = state;
        state = ConversationState.CLOSED;
        lastActivityAt = SwarmUtils.epochMicro();
        return Optional.of(new StateTransition(from, state, sequence.get()));
    }

    public long getLastActivityAt() {
        return lastActivityAt;
    }

    public synchronized List<MessageEnvelope> envelopes() {
        return List.copyOf(envelopes);
    }

    public synchronized ConversationView view() {
        return ConversationView.builder()
                .conversationId(id)
                .userId(userId)
                .swarmName(swarm.getName())
                .state(state)
                .turn(turn)
                .hops(hops)
                .envelopes(List.copyOf(envelopes))
                .createdAt(createdAt)
                .lastActivityAt(lastActivityAt)
                .build();
    }
}
