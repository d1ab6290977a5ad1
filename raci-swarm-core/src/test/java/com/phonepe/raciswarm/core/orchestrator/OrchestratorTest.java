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
import com.phonepe.raciswarm.core.conversation.ConversationState;
import com.phonepe.raciswarm.core.conversation.ConversationView;
import com.phonepe.raciswarm.core.envelope.EnvelopeKind;
import com.phonepe.raciswarm.core.envelope.MessageEnvelope;
import com.phonepe.raciswarm.core.errors.ErrorType;
import com.phonepe.raciswarm.core.events.EventBus;
import com.phonepe.raciswarm.core.events.HopFailedEvent;
import com.phonepe.raciswarm.core.events.StateTransitionEvent;
import com.phonepe.raciswarm.core.events.SwarmEvent;
import com.phonepe.raciswarm.core.memory.FragmentKind;
import com.phonepe.raciswarm.core.model.RaciRole;
import com.phonepe.raciswarm.core.routing.SwarmRegistry;
import com.phonepe.raciswarm.core.routing.SwarmRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.phonepe.raciswarm.core.TestAgents.ADMIN;
import static com.phonepe.raciswarm.core.TestAgents.CONSULTED;
import static com.phonepe.raciswarm.core.TestAgents.INITIALIZER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrchestratorTest {
    private List<SwarmEvent> events;
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        events = new CopyOnWriteArrayList<>();
        eventBus = EventBus.synchronous();
        eventBus.onEvent(events::add);
    }

    @Test
    void testUnsupportedRequestCreatesNoConversation() {
        final var orchestrator = orchestrator(TestAgents.standardRegistry(
                TestAgents.answering(CONSULTED, RaciRole.CONSULTED, "sheet")), OrchestratorSetup.DEFAULT);

        final var submission = orchestrator.submitRequest("generate-excel", "u1", "Make me a spreadsheet");
        assertFalse(submission.isAccepted());
        assertNull(submission.getConversationId());
        assertEquals(ErrorType.NO_MATCHING_SWARM, submission.getError().getErrorType());
        final var response = submission.getResponse().join();
        assertEquals(ResponseStatus.UNSUPPORTED, response.getStatus());
        assertTrue(orchestrator.conversations("u1").isEmpty());
        assertTrue(events.isEmpty());

        assertEquals(ResponseStatus.UNSUPPORTED,
                     orchestrator.handle(request("generate-excel", "anything")).getStatus());
    }

    @Test
    void testInitializerAdminConsultedRoundTrip() {
        final var orchestrator = orchestrator(TestAgents.standardRegistry(
                TestAgents.answering(CONSULTED, RaciRole.CONSULTED, "excel layout")), OrchestratorSetup.DEFAULT);

        final var response = orchestrator.handle(request("file-generation", "Generate a sales report"));
        assertEquals(ResponseStatus.COMPLETED, response.getStatus());
        assertEquals("Result: excel layout", response.getContent());

        final var view = orchestrator.conversation(response.getConversationId()).orElseThrow();
        assertEquals(ConversationState.AWAITING_USER, view.getState());
        final var envelopes = view.getEnvelopes();
        assertEquals(5, envelopes.size());
        assertNull(envelopes.get(0).getPendingUserReply());
        assertEquals(List.of(false, false, false, true),
                     envelopes.subList(1, 5).stream().map(MessageEnvelope::getPendingUserReply).toList());
        assertEquals(List.of("user:u1->initializer",
                             "initializer->admin",
                             "admin->consultant",
                             "consultant->admin",
                             "admin->initializer"),
                     envelopes.stream().map(e -> e.getSenderId() + "->" + e.getRecipientId()).toList());
        assertEquals(List.of(0, 1, 2, 3, 4), envelopes.stream().map(MessageEnvelope::getHop).toList());
        assertSingleTerminalAtEnd(view);
        assertEquals(response.getTerminalEnvelope(), envelopes.get(4));

        final var transitions = events.stream()
                .filter(StateTransitionEvent.class::isInstance)
                .map(StateTransitionEvent.class::cast)
                .toList();
        assertEquals(3, transitions.size());
        assertNull(transitions.get(0).getFromState());
        assertEquals(ConversationState.OPEN, transitions.get(0).getToState());
        assertEquals(ConversationState.DELEGATING, transitions.get(1).getToState());
        assertEquals(2, transitions.get(1).getSequenceNo());
        assertEquals(ConversationState.AWAITING_USER, transitions.get(2).getToState());
        assertEquals(5, transitions.get(2).getSequenceNo());
    }

    @Test
    void testTimedOutAgentIsRetriedOnceThenReportedToAdmin() {
        final var calls = new AtomicInteger();
        final var slow = TestAgents.agent(CONSULTED, RaciRole.CONSULTED, invocation -> {
            calls.incrementAndGet();
            sleep(5_000);
            return AgentReply.answer("too late");
        });
        final var setup = fastSetup().withHopTimeout(Duration.ofMillis(100));
        final var orchestrator = orchestrator(TestAgents.standardRegistry(slow), setup);

        final var response = orchestrator.handle(request("file-generation", "Generate a report"));
        assertEquals(2, calls.get());
        assertEquals(ResponseStatus.COMPLETED, response.getStatus());

        final var view = orchestrator.conversation(response.getConversationId()).orElseThrow();
        final var failure = view.getEnvelopes().get(3);
        assertEquals(EnvelopeKind.FAILURE, failure.getKind());
        assertEquals(CONSULTED, failure.getSenderId());
        assertEquals(ADMIN, failure.getRecipientId());
        assertEquals(ErrorType.AGENT_TIMEOUT, failure.getErrorType());
        assertEquals(Boolean.FALSE, failure.getPendingUserReply());
        assertEquals(ConversationState.AWAITING_USER, view.getState());
        assertSingleTerminalAtEnd(view);
        assertTrue(response.getContent().startsWith("Result: Agent consultant did not respond"));

        final var hopFailures = events.stream().filter(HopFailedEvent.class::isInstance).toList();
        assertEquals(1, hopFailures.size());
        assertEquals(2, ((HopFailedEvent) hopFailures.get(0)).getAttempts());
    }

    @Test
    void testHopCeilingProducesFallback() {
        final var registry = new SwarmRegistry()
                .registerAgent(TestAgents.initializer())
                .registerAgent(TestAgents.delegatingAdmin("c1"))
                .registerAgent(TestAgents.agent("c1", RaciRole.CONSULTED,
                                                invocation -> AgentReply.delegateTo("c2", "dig deeper")))
                .registerAgent(TestAgents.agent("c2", RaciRole.CONSULTED,
                                                invocation -> AgentReply.delegateTo("c1", "dig deeper")))
                .registerSwarm(TestAgents.swarm("loop", Set.of("rules"), INITIALIZER, ADMIN, "c1", "c2"));
        final var orchestrator = orchestrator(registry, fastSetup().withHopCeiling(10));

        final var response = orchestrator.handle(request("rules", "Extract quality rules"));
        assertEquals(ResponseStatus.FALLBACK, response.getStatus());
        assertEquals(ErrorType.DELEGATION_DEPTH_EXCEEDED, response.getError().getErrorType());

        final var view = orchestrator.conversation(response.getConversationId()).orElseThrow();
        assertEquals(ConversationState.AWAITING_USER, view.getState());
        assertEquals(11, view.getEnvelopes().size());
        final var fallback = view.getEnvelopes().get(10);
        assertEquals(10, fallback.getHop());
        assertEquals(EnvelopeKind.FALLBACK, fallback.getKind());
        assertEquals(ADMIN, fallback.getSenderId());
        assertEquals(INITIALIZER, fallback.getRecipientId());
        assertTrue(fallback.getContent().startsWith("Delegation hop ceiling of 10 reached"));
        assertTrue(fallback.getContent().contains("dig deeper"));
        assertSingleTerminalAtEnd(view);
    }

    @Test
    void testNestedDelegationCompletes() {
        final var registry = new SwarmRegistry()
                .registerAgent(TestAgents.initializer())
                .registerAgent(TestAgents.delegatingAdmin("c1"))
                .registerAgent(TestAgents.agent("c1", RaciRole.CONSULTED, invocation -> {
                    if (invocation.getEnvelope().getKind() == EnvelopeKind.DELEGATION) {
                        return AgentReply.delegateTo("c2", "find the details");
                    }
                    return AgentReply.answer("summarized " + invocation.goal());
                }))
                .registerAgent(TestAgents.answering("c2", RaciRole.CONSULTED, "details"))
                .registerSwarm(TestAgents.swarm("nested", Set.of("rules"), INITIALIZER, ADMIN, "c1", "c2"));
        final var orchestrator = orchestrator(registry, fastSetup());

        final var response = orchestrator.handle(request("rules", "Extract quality rules"));
        assertEquals(ResponseStatus.COMPLETED, response.getStatus());
        assertEquals("Result: summarized details", response.getContent());

        final var view = orchestrator.conversation(response.getConversationId()).orElseThrow();
        assertEquals(ConversationState.AWAITING_USER, view.getState());
        final var envelopes = view.getEnvelopes();
        assertEquals(List.of("user:u1->initializer",
                             "initializer->admin",
                             "admin->c1",
                             "c1->c2",
                             "c2->c1",
                             "c1->admin",
                             "admin->initializer"),
                     envelopes.stream().map(e -> e.getSenderId() + "->" + e.getRecipientId()).toList());
        assertEquals(List.of(EnvelopeKind.DELEGATION, EnvelopeKind.ANSWER, EnvelopeKind.ANSWER),
                     envelopes.subList(3, 6).stream().map(MessageEnvelope::getKind).toList());
        //Each answer goes back to the delegation that asked for it
        assertEquals(envelopes.get(3).getSequenceNo(), envelopes.get(4).getReplyTo());
        assertEquals(envelopes.get(2).getSequenceNo(), envelopes.get(5).getReplyTo());
        assertSingleTerminalAtEnd(view);
    }

    @Test
    void testAgentIgnoringInterruptsCannotStallTurn() {
        final var slow = TestAgents.agent(CONSULTED, RaciRole.CONSULTED, invocation -> {
            busyWait(3_000);
            return AgentReply.answer("too late");
        });
        final var setup = fastSetup().withHopTimeout(Duration.ofMillis(100));
        final var orchestrator = orchestrator(TestAgents.standardRegistry(slow), setup);

        final var started = System.nanoTime();
        final var response = orchestrator.handle(request("file-generation", "Generate a report"));
        final var elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertTrue(elapsed.compareTo(Duration.ofMillis(1_500)) < 0, "Took " + elapsed);
        assertEquals(ResponseStatus.COMPLETED, response.getStatus());
        final var failure = orchestrator.conversation(response.getConversationId())
                .orElseThrow()
                .getEnvelopes()
                .get(3);
        assertEquals(EnvelopeKind.FAILURE, failure.getKind());
        assertEquals(ErrorType.AGENT_TIMEOUT, failure.getErrorType());
    }

    @Test
    void testFanOutReactsOnceToLastAnswer() {
        final var adminCalls = new AtomicInteger();
        final var admin = TestAgents.agent(ADMIN, RaciRole.ACCOUNTABLE, invocation -> {
            adminCalls.incrementAndGet();
            if (invocation.getEnvelope().getKind() == EnvelopeKind.DELEGATION) {
                return AgentReply.delegateToRole(RaciRole.CONSULTED, "your view please");
            }
            final var answers = invocation.getContext()
                    .getFragments()
                    .stream()
                    .filter(fragment -> fragment.getKind() == FragmentKind.ENVELOPE)
                    .filter(fragment -> fragment.getEnvelopeKind() == EnvelopeKind.ANSWER)
                    .count();
            return AgentReply.answer("answers=" + answers + " last=" + invocation.requesterId());
        });
        final var registry = new SwarmRegistry()
                .registerAgent(TestAgents.initializer())
                .registerAgent(admin)
                .registerAgent(TestAgents.answering("c1", RaciRole.CONSULTED, "one"))
                .registerAgent(TestAgents.answering("c2", RaciRole.CONSULTED, "two"))
                .registerAgent(TestAgents.answering("c3", RaciRole.CONSULTED, "three"))
                .registerSwarm(TestAgents.swarm("panel", Set.of("review"), INITIALIZER, ADMIN, "c1", "c2", "c3"));
        final var orchestrator = orchestrator(registry, fastSetup());

        final var response = orchestrator.handle(request("review", "Review this"));
        assertEquals("answers=3 last=c3", response.getContent());
        assertEquals(2, adminCalls.get());
        final var view = orchestrator.conversation(response.getConversationId()).orElseThrow();
        assertEquals(9, view.getEnvelopes().size());
        assertSingleTerminalAtEnd(view);
    }

    @Test
    void testRoleViolationBecomesFailureEnvelope() {
        final var rogue = TestAgents.agent(CONSULTED, RaciRole.CONSULTED,
                                           invocation -> AgentReply.delegateTo(ADMIN, "you do it"));
        final var orchestrator = orchestrator(TestAgents.standardRegistry(rogue), fastSetup());

        final var response = orchestrator.handle(request("file-generation", "Generate a report"));
        assertEquals(ResponseStatus.COMPLETED, response.getStatus());
        final var view = orchestrator.conversation(response.getConversationId()).orElseThrow();
        final var failure = view.getEnvelopes().get(3);
        assertEquals(EnvelopeKind.FAILURE, failure.getKind());
        assertEquals(ErrorType.ROLE_VIOLATION, failure.getErrorType());
        assertEquals(ADMIN, failure.getRecipientId());
        assertSingleTerminalAtEnd(view);
    }

    @Test
    void testAgentErrorsAreNotRetried() {
        final var calls = new AtomicInteger();
        final var broken = TestAgents.agent(CONSULTED, RaciRole.CONSULTED, invocation -> {
            calls.incrementAndGet();
            throw new IllegalStateException("tool service unavailable");
        });
        final var orchestrator = orchestrator(TestAgents.standardRegistry(broken), fastSetup());

        final var response = orchestrator.handle(request("file-generation", "Generate a report"));
        assertEquals(1, calls.get());
        assertEquals(ResponseStatus.COMPLETED, response.getStatus());
        final var failure = orchestrator.conversation(response.getConversationId())
                .orElseThrow()
                .getEnvelopes()
                .get(3);
        assertEquals(ErrorType.AGENT_FAILURE, failure.getErrorType());
        assertTrue(failure.getContent().contains("tool service unavailable"));
    }

    @Test
    void testAdminFailureDegradesGracefully() {
        final var registry = new SwarmRegistry()
                .registerAgent(TestAgents.initializer())
                .registerAgent(TestAgents.agent(ADMIN, RaciRole.ACCOUNTABLE, invocation -> {
                    throw new IllegalStateException("model unavailable");
                }))
                .registerSwarm(TestAgents.swarm("fragile", Set.of("code-generation"), INITIALIZER, ADMIN));
        final var orchestrator = orchestrator(registry, fastSetup());

        final var response = orchestrator.handle(request("code-generation", "Write code"));
        assertEquals(ResponseStatus.DEGRADED, response.getStatus());
        assertEquals(OrchestratorSetup.DEFAULT_DEGRADED_MESSAGE, response.getContent());
        assertEquals(ErrorType.AGENT_FAILURE, response.getError().getErrorType());
        final var view = orchestrator.conversation(response.getConversationId()).orElseThrow();
        assertEquals(ConversationState.AWAITING_USER, view.getState());
        assertEquals(EnvelopeKind.FAILURE, response.getTerminalEnvelope().getKind());
        assertSingleTerminalAtEnd(view);
    }

    @Test
    void testConversationTimeoutGivesDegradedResponse() {
        final var slow = TestAgents.agent(CONSULTED, RaciRole.CONSULTED, invocation -> {
            sleep(300);
            return AgentReply.answer("finally");
        });
        final var setup = fastSetup()
                .withHopTimeout(Duration.ofSeconds(5))
                .withConversationTimeout(Duration.ofMillis(100));
        final var orchestrator = orchestrator(TestAgents.standardRegistry(slow), setup);

        final var response = orchestrator.handle(request("file-generation", "Generate a report"));
        assertEquals(ResponseStatus.DEGRADED, response.getStatus());
        assertEquals(ErrorType.CONVERSATION_TIMEOUT, response.getError().getErrorType());
        assertEquals(OrchestratorSetup.DEFAULT_DEGRADED_MESSAGE, response.getContent());
        final var view = orchestrator.conversation(response.getConversationId()).orElseThrow();
        assertEquals(ConversationState.AWAITING_USER, view.getState());
        assertEquals(EnvelopeKind.FALLBACK, response.getTerminalEnvelope().getKind());
        assertSingleTerminalAtEnd(view);
    }

    @Test
    void testInformedAgentsAreKeptUpToDate() {
        final var informedCalls = new AtomicInteger();
        final var registry = new SwarmRegistry()
                .registerAgent(TestAgents.initializer())
                .registerAgent(TestAgents.delegatingAdmin("auditor"))
                .registerAgent(TestAgents.agent("auditor", RaciRole.INFORMED, invocation -> {
                    informedCalls.incrementAndGet();
                    return AgentReply.answer("noted");
                }))
                .registerSwarm(TestAgents.swarm("audited", Set.of("file-reading"), INITIALIZER, ADMIN, "auditor"));
        final var orchestrator = orchestrator(registry, fastSetup());

        final var response = orchestrator.handle(request("file reading", "Read the file"));
        assertEquals("Result: noted", response.getContent());
        assertEquals(1, informedCalls.get());
    }

    @Test
    void testEveryAgentSeesOnlyItsSlice() {
        final var seenByConsultant = new CopyOnWriteArrayList<Long>();
        final var rosterSize = new AtomicInteger();
        final var consultant = TestAgents.agent(CONSULTED, RaciRole.CONSULTED, invocation -> {
            invocation.getContext().getFragments().forEach(fragment -> seenByConsultant.add(fragment.getSequenceFrom()));
            rosterSize.set(invocation.getRoster().size());
            return AgentReply.answer("done");
        });
        final var orchestrator = orchestrator(TestAgents.standardRegistry(consultant), fastSetup());
        orchestrator.handle(request("file-generation", "Generate"));
        assertEquals(3, rosterSize.get());
        //User request and the delegation addressed to it, not the initializer to admin hand-off
        assertEquals(List.of(1L, 3L), seenByConsultant);
    }

    private Orchestrator orchestrator(SwarmRegistry registry, OrchestratorSetup setup) {
        return Orchestrator.builder()
                .router(new SwarmRouter(registry))
                .setup(setup)
                .eventBus(eventBus)
                .build();
    }

    static OrchestratorSetup fastSetup() {
        return OrchestratorSetup.builder()
                .hopTimeout(Duration.ofSeconds(2))
                .retrySetup(HopRetrySetup.builder()
                                    .initialDelay(Duration.ofMillis(10))
                                    .maxDelay(Duration.ofMillis(50))
                                    .build())
                .build();
    }

    static SwarmRequest request(String capability, String text) {
        return SwarmRequest.builder()
                .capability(capability)
                .userId("u1")
                .text(text)
                .build();
    }

    static void assertSingleTerminalAtEnd(ConversationView view) {
        final var envelopes = view.getEnvelopes();
        final var terminals = envelopes.stream().filter(MessageEnvelope::isTerminal).toList();
        assertEquals(1, terminals.size());
        final var last = envelopes.get(envelopes.size() - 1);
        assertTrue(last.isTerminal());
        assertEquals(INITIALIZER, last.getRecipientId());
        final var sequences = envelopes.stream().mapToLong(MessageEnvelope::getSequenceNo).toArray();
        for (int i = 1; i < sequences.length; i++) {
            assertTrue(sequences[i] > sequences[i - 1], "Sequence numbers not increasing: "
                    + Arrays.toString(sequences));
        }
    }

    /**
     * Spins without ever checking for interrupts
     */
    static void busyWait(long millis) {
        final var deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
        while (System.nanoTime() < deadline) {
            Thread.onSpinWait();
        }
    }

    static void sleep(long millis) {
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted", e);
        }
    }
}
