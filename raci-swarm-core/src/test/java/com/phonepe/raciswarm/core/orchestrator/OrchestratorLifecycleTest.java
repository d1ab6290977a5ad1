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

import com.phonepe.raciswarm.core.TestAgents;
import com.phonepe.raciswarm.core.agent.AgentReply;
import com.phonepe.raciswarm.core.agent.SwarmAgent;
import com.phonepe.raciswarm.core.archive.InMemoryConversationArchive;
import com.phonepe.raciswarm.core.conversation.ConversationState;
import com.phonepe.raciswarm.core.conversation.InMemoryConversationStore;
import com.phonepe.raciswarm.core.envelope.EnvelopeKind;
import com.phonepe.raciswarm.core.envelope.MessageEnvelope;
import com.phonepe.raciswarm.core.errors.ErrorType;
import com.phonepe.raciswarm.core.errors.SwarmException;
import com.phonepe.raciswarm.core.events.EventBus;
import com.phonepe.raciswarm.core.events.StateTransitionEvent;
import com.phonepe.raciswarm.core.events.SwarmEvent;
import com.phonepe.raciswarm.core.model.RaciRole;
import com.phonepe.raciswarm.core.routing.SwarmRouter;
import lombok.SneakyThrows;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static com.phonepe.raciswarm.core.TestAgents.CONSULTED;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrchestratorLifecycleTest {
    private final List<SwarmEvent> events = new CopyOnWriteArrayList<>();
    private InMemoryConversationArchive archive;
    private InMemoryConversationStore store;
    private ExecutorService executorService;

    @BeforeEach
    void setUp() {
        archive = new InMemoryConversationArchive();
        store = new InMemoryConversationStore();
        executorService = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    void testReplyContinuesConversation() {
        final var orchestrator = orchestrator(TestAgents.answering(CONSULTED, RaciRole.CONSULTED, "layout"),
                                              OrchestratorTest.fastSetup());
        final var first = orchestrator.handle(OrchestratorTest.request("file-generation", "Generate a report"));
        final var second = orchestrator.reply(first.getConversationId(), "u1", "Add a chart too");

        assertEquals(first.getConversationId(), second.getConversationId());
        assertEquals(2, second.getTurn());
        assertEquals(ResponseStatus.COMPLETED, second.getStatus());

        final var view = orchestrator.conversation(first.getConversationId()).orElseThrow();
        assertEquals(2, view.getTurn());
        assertEquals(ConversationState.AWAITING_USER, view.getState());
        assertEquals(10, view.getEnvelopes().size());
        for (int turn = 1; turn <= 2; turn++) {
            final var current = turn;
            assertEquals(1, view.getEnvelopes()
                    .stream()
                    .filter(envelope -> envelope.getTurn() == current)
                    .filter(MessageEnvelope::isTerminal)
                    .count());
        }
        final var secondRequest = view.getEnvelopes().get(5);
        assertEquals(EnvelopeKind.USER_REQUEST, secondRequest.getKind());
        assertEquals(0, secondRequest.getHop());
        assertEquals(6, secondRequest.getSequenceNo());
        assertEquals(second.getTerminalEnvelope(), view.terminalEnvelope().orElseThrow());
    }

    @Test
    void testReplyToUnknownConversation() {
        final var orchestrator = orchestrator(TestAgents.answering(CONSULTED, RaciRole.CONSULTED, "layout"),
                                              OrchestratorTest.fastSetup());
        final var response = orchestrator.handle(OrchestratorTest.request("file-generation", "Generate"));

        var error = assertThrows(SwarmException.class, () -> orchestrator.reply("missing", "u1", "hello"));
        assertEquals(ErrorType.CONVERSATION_NOT_FOUND, error.getErrorType());
        error = assertThrows(SwarmException.class,
                             () -> orchestrator.reply(response.getConversationId(), "u2", "hello"));
        assertEquals(ErrorType.CONVERSATION_NOT_FOUND, error.getErrorType());
        error = assertThrows(SwarmException.class, () -> orchestrator.close("missing"));
        assertEquals(ErrorType.CONVERSATION_NOT_FOUND, error.getErrorType());
    }

    @Test
    void testCloseArchivesConversation() {
        final var orchestrator = orchestrator(TestAgents.answering(CONSULTED, RaciRole.CONSULTED, "layout"),
                                              OrchestratorTest.fastSetup());
        final var response = orchestrator.handle(OrchestratorTest.request("file-generation", "Generate"));
        final var conversationId = response.getConversationId();

        assertTrue(orchestrator.close(conversationId));
        assertFalse(orchestrator.close(conversationId));
        assertFalse(orchestrator.getMemory().isLive(conversationId));
        assertEquals(ConversationState.CLOSED, orchestrator.conversation(conversationId).orElseThrow().getState());

        final var archived = archive.read(conversationId).orElseThrow();
        assertEquals("u1", archived.getUserId());
        assertEquals("file-swarm", archived.getSwarmName());
        assertEquals(1, archived.getTurns());
        assertEquals(5, archived.getEnvelopes().size());
        assertEquals(5, archived.getSnapshot().getFragments().size());
        assertTrue(archived.getLateEnvelopes().isEmpty());

        final var closing = events.stream()
                .filter(StateTransitionEvent.class::isInstance)
                .map(StateTransitionEvent.class::cast)
                .filter(event -> event.getToState() == ConversationState.CLOSED)
                .toList();
        assertEquals(1, closing.size());
        assertEquals(ConversationState.AWAITING_USER, closing.get(0).getFromState());

        final var afterClose = orchestrator.reply(conversationId, "u1", "Anything else?");
        assertEquals(ResponseStatus.CLOSED, afterClose.getStatus());
        assertEquals(ErrorType.CONVERSATION_CLOSED, afterClose.getError().getErrorType());
    }

    @Test
    void testClosedConversationsLeaveTheStore() {
        final var orchestrator = orchestrator(TestAgents.answering(CONSULTED, RaciRole.CONSULTED, "layout"),
                                              OrchestratorTest.fastSetup());
        final var conversationIds = IntStream.range(0, 5)
                .mapToObj(i -> orchestrator.handle(OrchestratorTest.request("file-generation", "Request " + i)))
                .map(SwarmResponse::getConversationId)
                .toList();
        assertEquals(5, store.forUser("u1").size());

        conversationIds.forEach(conversationId -> assertTrue(orchestrator.close(conversationId)));
        assertTrue(store.forUser("u1").isEmpty());
        assertTrue(store.active().isEmpty());
        assertTrue(orchestrator.conversations("u1").isEmpty());

        final var view = orchestrator.conversation(conversationIds.get(0)).orElseThrow();
        assertEquals(ConversationState.CLOSED, view.getState());
        assertEquals(5, view.getEnvelopes().size());
        assertEquals("file-swarm", view.getSwarmName());

        final var error = assertThrows(SwarmException.class,
                                       () -> orchestrator.reply(conversationIds.get(0), "u2", "hello"));
        assertEquals(ErrorType.CONVERSATION_NOT_FOUND, error.getErrorType());
    }

    @Test
    @SneakyThrows
    void testResponseAfterCloseIsArchivedNotRouted() {
        final var invoked = new CountDownLatch(1);
        final var proceed = new CountDownLatch(1);
        final var blocking = TestAgents.agent(CONSULTED, RaciRole.CONSULTED, invocation -> {
            invoked.countDown();
            awaitLatch(proceed);
            return AgentReply.answer("finished anyway");
        });
        final var orchestrator = orchestrator(blocking,
                                              OrchestratorTest.fastSetup().withHopTimeout(Duration.ofSeconds(10)));
        final var submission = orchestrator.submitRequest("file-generation", "u1", "Generate");
        assertTrue(submission.isAccepted());
        assertTrue(invoked.await(5, TimeUnit.SECONDS));

        assertTrue(orchestrator.close(submission.getConversationId()));
        proceed.countDown();
        final var response = submission.getResponse().get(5, TimeUnit.SECONDS);
        assertEquals(ResponseStatus.CLOSED, response.getStatus());

        final var view = orchestrator.conversation(submission.getConversationId()).orElseThrow();
        assertEquals(ConversationState.CLOSED, view.getState());
        assertEquals(3, view.getEnvelopes().size());

        final var archived = archive.read(submission.getConversationId()).orElseThrow();
        assertEquals(3, archived.getEnvelopes().size());
        assertEquals(1, archived.getLateEnvelopes().size());
        final var late = archived.getLateEnvelopes().get(0);
        assertEquals(CONSULTED, late.getSenderId());
        assertEquals("finished anyway", late.getContent());
    }

    @Test
    void testCloseInactive() {
        final var orchestrator = orchestrator(TestAgents.answering(CONSULTED, RaciRole.CONSULTED, "layout"),
                                              OrchestratorTest.fastSetup()
                                                      .withInactivityTimeout(Duration.ofMillis(1)));
        final var response = orchestrator.handle(OrchestratorTest.request("file-generation", "Generate"));
        await().pollDelay(Duration.ofMillis(5))
                .atMost(Duration.ofSeconds(2))
                .until(() -> orchestrator.closeInactive() == 1);
        assertEquals(ConversationState.CLOSED,
                     orchestrator.conversation(response.getConversationId()).orElseThrow().getState());
        assertEquals(0, orchestrator.closeInactive());
        assertTrue(archive.read(response.getConversationId()).isPresent());
    }

    @Test
    void testSweeperClosesIdleConversations() {
        final var orchestrator = orchestrator(TestAgents.answering(CONSULTED, RaciRole.CONSULTED, "layout"),
                                              OrchestratorTest.fastSetup()
                                                      .withInactivityTimeout(Duration.ofMillis(10))
                                                      .withSweepInterval(Duration.ofMillis(20)))
                .start();
        try {
            final var response = orchestrator.handle(OrchestratorTest.request("file-generation", "Generate"));
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> orchestrator.conversation(response.getConversationId())
                            .map(view -> view.getState() == ConversationState.CLOSED)
                            .orElse(false));
        }
        finally {
            orchestrator.stop();
        }
    }

    @Test
    @SneakyThrows
    void testConversationsRunIndependently() {
        final var orchestrator = orchestrator(TestAgents.answering(CONSULTED, RaciRole.CONSULTED, "layout"),
                                              OrchestratorTest.fastSetup().withExecutorService(executorService));
        final var futures = IntStream.range(0, 12)
                .mapToObj(i -> orchestrator.handleAsync(OrchestratorTest.request("file-generation", "Request " + i)))
                .toList();
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get(10, TimeUnit.SECONDS);
        for (final var future : futures) {
            final var response = future.get();
            assertEquals(ResponseStatus.COMPLETED, response.getStatus());
            final var view = orchestrator.conversation(response.getConversationId()).orElseThrow();
            assertEquals(5, view.getEnvelopes().size());
            OrchestratorTest.assertSingleTerminalAtEnd(view);
        }
        assertEquals(12, orchestrator.conversations("u1").size());
    }

    @Test
    @SneakyThrows
    void testStopShutsDownOnlyOwnedExecutors() {
        final var owning = orchestrator(TestAgents.answering(CONSULTED, RaciRole.CONSULTED, "layout"),
                                        OrchestratorTest.fastSetup());
        assertEquals(ResponseStatus.COMPLETED,
                     owning.handleAsync(OrchestratorTest.request("file-generation", "Generate"))
                             .get(5, TimeUnit.SECONDS)
                             .getStatus());
        owning.stop();
        assertThrows(RejectedExecutionException.class,
                     () -> owning.handleAsync(OrchestratorTest.request("file-generation", "Generate")));

        final var borrowing = orchestrator(TestAgents.answering(CONSULTED, RaciRole.CONSULTED, "layout"),
                                           OrchestratorTest.fastSetup()
                                                   .withExecutorService(executorService)
                                                   .withAgentExecutorService(executorService));
        borrowing.stop();
        assertFalse(executorService.isShutdown());
        assertEquals(ResponseStatus.COMPLETED,
                     borrowing.handleAsync(OrchestratorTest.request("file-generation", "Generate"))
                             .get(5, TimeUnit.SECONDS)
                             .getStatus());
    }

    private Orchestrator orchestrator(SwarmAgent consulted, OrchestratorSetup setup) {
        final var eventBus = EventBus.synchronous();
        eventBus.onEvent(events::add);
        return Orchestrator.builder()
                .router(new SwarmRouter(TestAgents.standardRegistry(consulted)))
                .setup(setup)
                .store(store)
                .archive(archive)
                .eventBus(eventBus)
                .build();
    }

    private static void awaitLatch(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Latch was never released");
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted", e);
        }
    }
}
