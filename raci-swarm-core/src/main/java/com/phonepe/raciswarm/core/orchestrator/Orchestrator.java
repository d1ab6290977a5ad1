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

package com.phonepe.raciswarm.core.orchestrator;

import com.google.common.base.Strings;
import com.phonepe.raciswarm.core.archive.ArchivedConversation;
import com.phonepe.raciswarm.core.archive.ConversationArchive;
import com.phonepe.raciswarm.core.conversation.Conversation;
import com.phonepe.raciswarm.core.conversation.ConversationState;
import com.phonepe.raciswarm.core.conversation.ConversationStore;
import com.phonepe.raciswarm.core.conversation.ConversationView;
import com.phonepe.raciswarm.core.conversation.InMemoryConversationStore;
import com.phonepe.raciswarm.core.errors.ErrorType;
import com.phonepe.raciswarm.core.errors.ParameterValidationError;
import com.phonepe.raciswarm.core.errors.SwarmError;
import com.phonepe.raciswarm.core.errors.SwarmException;
import com.phonepe.raciswarm.core.events.EventBus;
import com.phonepe.raciswarm.core.events.StateTransitionEvent;
import com.phonepe.raciswarm.core.memory.MemoryManager;
import com.phonepe.raciswarm.core.memory.Summarizer;
import com.phonepe.raciswarm.core.routing.ResolvedSwarm;
import com.phonepe.raciswarm.core.routing.SwarmRouter;
import com.phonepe.raciswarm.core.utils.SwarmUtils;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for running swarms. Resolves the swarm for a request, opens a conversation and drives it until control
 * goes back to the user.
 * <p>
 * Each conversation is driven by one thread at a time. Different conversations run independently.
 */
@Slf4j
public class Orchestrator {
    private final SwarmRouter router;
    @Getter
    private final OrchestratorSetup setup;
    private final ConversationStore store;
    @Getter
    private final MemoryManager memory;
    @Getter
    private final EventBus eventBus;
    private final AgentInvoker invoker;
    private final ExecutorService executorService;
    private final List<ExecutorService> ownedExecutors = new ArrayList<>();
    private ScheduledExecutorService sweeper;

    @Builder
    public Orchestrator(
            @NonNull SwarmRouter router,
            OrchestratorSetup setup,
            ConversationStore store,
            ConversationArchive archive,
            Summarizer summarizer,
            EventBus eventBus) {
        this.router = router;
        this.setup = Objects.requireNonNullElse(setup, OrchestratorSetup.DEFAULT);
        this.store = Objects.requireNonNullElseGet(store, InMemoryConversationStore::new);
        this.eventBus = Objects.requireNonNullElseGet(eventBus, EventBus::new);
        this.memory = MemoryManager.builder()
                .setup(this.setup.getMemorySetup())
                .summarizer(summarizer)
                .archive(archive)
                .eventBus(this.eventBus)
                .build();
        this.executorService = Objects.requireNonNullElseGet(this.setup.getExecutorService(), this::ownedPool);
        this.invoker = new AgentInvoker(this.setup.getHopTimeout(),
                                        this.setup.getRetrySetup(),
                                        Objects.requireNonNullElseGet(this.setup.getAgentExecutorService(),
                                                                      this::ownedPool));
    }

    /**
     * Run a request to completion on the calling thread
     *
     * @return The final response. Requests for capabilities nobody handles get an {@link ResponseStatus#UNSUPPORTED}
     * response.
     */
    public SwarmResponse handle(SwarmRequest request) {
        final var swarm = router.find(request.getCapability());
        if (swarm.isEmpty()) {
            return unsupported(request.getCapability());
        }
        final var conversation = open(request.getUserId(), swarm.get());
        return runTurn(conversation, request.getText());
    }

    public CompletableFuture<SwarmResponse> handleAsync(SwarmRequest request) {
        return submitRequest(request.getCapability(), request.getUserId(), request.getText()).getResponse();
    }

    /**
     * Accept a request and run it in the background
     *
     * @param capabilityTag Capability requested
     * @param userId        User making the request
     * @param text          Request text
     * @return The submission. Carries the new conversation id, or a {@link ErrorType#NO_MATCHING_SWARM} error and no
     * conversation when the capability is not supported.
     */
    public Submission submitRequest(String capabilityTag, String userId, String text) {
        validate(userId, text);
        final var swarm = router.find(capabilityTag);
        if (swarm.isEmpty()) {
            return Submission.rejected(unsupported(capabilityTag));
        }
        final var conversation = open(userId, swarm.get());
        return Submission.accepted(conversation.getId(),
                                   CompletableFuture.supplyAsync(() -> runTurn(conversation, text), executorService));
    }

    /**
     * Continue a conversation with the next user turn. Waits for any turn still in progress. Closed conversations get
     * a {@link ResponseStatus#CLOSED} response.
     *
     * @throws SwarmException with {@link ErrorType#CONVERSATION_NOT_FOUND} if the user has no such conversation
     */
    public SwarmResponse reply(String conversationId, String userId, String text) {
        validate(userId, text);
        final var conversation = store.get(conversationId)
                .filter(existing -> existing.getUserId().equals(userId))
                .orElse(null);
        if (null != conversation) {
            return runTurn(conversation, text);
        }
        return memory.archived(conversationId)
                .filter(archived -> userId.equals(archived.getUserId()))
                .map(archived -> closedResponse(conversationId, archived.getTurns()))
                .orElseThrow(() -> new SwarmException(ErrorType.CONVERSATION_NOT_FOUND, conversationId));
    }

    public CompletableFuture<SwarmResponse> replyAsync(String conversationId, String userId, String text) {
        return CompletableFuture.supplyAsync(() -> reply(conversationId, userId, text), executorService);
    }

    /**
     * End a conversation. Its memory goes to the archive and it leaves the conversation store. Safe to call while a
     * turn is still running; whatever that turn produces afterwards is archived and not routed.
     *
     * @return true if the conversation was open and is now closed
     */
    public boolean close(String conversationId) {
        final var conversation = store.get(conversationId).orElse(null);
        if (null == conversation) {
            if (memory.archived(conversationId).isPresent()) {
                return false;
            }
            throw new SwarmException(ErrorType.CONVERSATION_NOT_FOUND, conversationId);
        }
        final var transition = conversation.close().orElse(null);
        if (null == transition) {
            return false;
        }
        eventBus.notify(StateTransitionEvent.builder()
                                .conversationId(conversationId)
                                .fromState(transition.from())
                                .toState(transition.to())
                                .sequenceNo(transition.sequenceNo())
                                .build());
        memory.release(ArchivedConversation.builder()
                               .conversationId(conversationId)
                               .userId(conversation.getUserId())
                               .swarmName(conversation.getSwarmName())
                               .turns(conversation.currentTurn())
                               .envelopes(conversation.envelopes())
                               .closedAt(SwarmUtils.epochMicro())
                               .build());
        store.remove(conversationId);
        log.info("Closed conversation {} (was {})", conversationId, transition.from());
        return true;
    }

    /**
     * Close every conversation that has been waiting on its user for longer than the inactivity timeout
     *
     * @return Number of conversations closed
     */
    public int closeInactive() {
        final var cutoff = SwarmUtils.epochMicro() - setup.getInactivityTimeout().toNanos() / 1_000;
        final var idle = store.active()
                .stream()
                .filter(conversation -> conversation.state() == ConversationState.AWAITING_USER)
                .filter(conversation -> conversation.getLastActivityAt() < cutoff)
                .map(Conversation::getId)
                .toList();
        final var closed = (int) idle.stream().filter(this::close).count();
        if (closed > 0) {
            log.info("Closed {} inactive conversations", closed);
        }
        return closed;
    }

    /**
     * Current view of a conversation. Closed conversations are read back from the archive.
     */
    public Optional<ConversationView> conversation(String conversationId) {
        final var conversation = store.get(conversationId);
        if (conversation.isPresent()) {
            return conversation.map(Conversation::view);
        }
        return memory.archived(conversationId).map(Orchestrator::archivedView);
    }

    public List<ConversationView> conversations(String userId) {
        return store.forUser(userId)
                .stream()
                .map(Conversation::view)
                .toList();
    }

    /**
     * Start the background sweep that closes inactive conversations
     */
    public synchronized Orchestrator start() {
        if (null != sweeper) {
            return this;
        }
        final var interval = setup.getSweepInterval().toMillis();
        sweeper = Executors.newSingleThreadScheduledExecutor();
        sweeper.scheduleWithFixedDelay(this::sweep, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Inactive conversation sweep started. Interval: {}", setup.getSweepInterval());
        return this;
    }

    /**
     * Stop the sweep and shut down the thread pools this orchestrator created. Executors passed in through
     * {@link OrchestratorSetup} are left alone. Turns cannot be run once the orchestrator is stopped unless both
     * executors were provided.
     */
    public synchronized void stop() {
        if (null != sweeper) {
            sweeper.shutdownNow();
            sweeper = null;
            log.info("Inactive conversation sweep stopped");
        }
        ownedExecutors.forEach(ExecutorService::shutdownNow);
        if (!ownedExecutors.isEmpty()) {
            log.info("Shut down {} orchestrator thread pools", ownedExecutors.size());
        }
    }

    private void sweep() {
        try {
            closeInactive();
        }
        catch (RuntimeException e) {
            log.error("Error closing inactive conversations", e);
        }
    }

    private Conversation open(String userId, ResolvedSwarm swarm) {
        final var conversation = new Conversation(SwarmUtils.conversationId(userId), userId, swarm);
        memory.open(conversation.getId(), swarm.roles());
        store.save(conversation);
        log.info("Opened conversation {} for user {} on swarm {}", conversation.getId(), userId, swarm.getName());
        return conversation;
    }

    private SwarmResponse runTurn(Conversation conversation, String text) {
        final var lock = conversation.turnLock();
        lock.lock();
        try {
            if (conversation.isClosed()) {
                return closedResponse(conversation.getId(), conversation.currentTurn());
            }
            final var turn = conversation.startTurn();
            final var started = System.nanoTime();
            final var response = TurnDriver.builder()
                    .conversation(conversation)
                    .setup(setup)
                    .invoker(invoker)
                    .memory(memory)
                    .eventBus(eventBus)
                    .turn(turn)
                    .build()
                    .run(conversation.getUserId(), text);
            log.info("Conversation {} turn {} finished with status {} after {} hops in {}",
                     conversation.getId(), turn, response.getStatus(), conversation.hops(),
                     Duration.ofNanos(System.nanoTime() - started));
            return response;
        }
        finally {
            lock.unlock();
        }
    }

    private ExecutorService ownedPool() {
        final var pool = Executors.newCachedThreadPool();
        ownedExecutors.add(pool);
        return pool;
    }

    private static SwarmResponse closedResponse(String conversationId, int turn) {
        return SwarmResponse.builder()
                .conversationId(conversationId)
                .turn(turn)
                .status(ResponseStatus.CLOSED)
                .error(SwarmError.error(ErrorType.CONVERSATION_CLOSED, conversationId))
                .build();
    }

    private static ConversationView archivedView(ArchivedConversation archived) {
        final var envelopes = archived.getEnvelopes();
        return ConversationView.builder()
                .conversationId(archived.getConversationId())
                .userId(archived.getUserId())
                .swarmName(archived.getSwarmName())
                .state(ConversationState.CLOSED)
                .turn(archived.getTurns())
                .envelopes(envelopes)
                .createdAt(envelopes.isEmpty() ? archived.getClosedAt() : envelopes.get(0).getTimestamp())
                .lastActivityAt(archived.getClosedAt())
                .build();
    }

    private static SwarmResponse unsupported(String capabilityTag) {
        final var error = SwarmError.error(ErrorType.NO_MATCHING_SWARM, capabilityTag);
        log.info(error.getMessage());
        return SwarmResponse.builder()
                .status(ResponseStatus.UNSUPPORTED)
                .content(error.getMessage())
                .error(error)
                .build();
    }

    private static void validate(String userId, String text) {
        if (Strings.isNullOrEmpty(userId)) {
            throw new ParameterValidationError("User id is required");
        }
        if (null == text) {
            throw new ParameterValidationError("Request text is required");
        }
    }
}
