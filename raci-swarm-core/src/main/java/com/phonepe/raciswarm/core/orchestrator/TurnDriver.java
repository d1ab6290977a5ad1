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

import com.phonepe.raciswarm.core.agent.AgentInvocation;
import com.phonepe.raciswarm.core.agent.AgentReplyVisitor;
import com.phonepe.raciswarm.core.agent.SwarmAgent;
import com.phonepe.raciswarm.core.agent.replies.Answer;
import com.phonepe.raciswarm.core.agent.replies.Delegation;
import com.phonepe.raciswarm.core.conversation.Conversation;
import com.phonepe.raciswarm.core.conversation.ConversationStateMachine;
import com.phonepe.raciswarm.core.conversation.DelegationFrame;
import com.phonepe.raciswarm.core.conversation.Delivery;
import com.phonepe.raciswarm.core.envelope.EnvelopeKind;
import com.phonepe.raciswarm.core.envelope.MessageEnvelope;
import com.phonepe.raciswarm.core.errors.ErrorType;
import com.phonepe.raciswarm.core.errors.SwarmError;
import com.phonepe.raciswarm.core.errors.SwarmException;
import com.phonepe.raciswarm.core.events.EnvelopeDeliveredEvent;
import com.phonepe.raciswarm.core.events.EventBus;
import com.phonepe.raciswarm.core.events.HopFailedEvent;
import com.phonepe.raciswarm.core.events.StateTransitionEvent;
import com.phonepe.raciswarm.core.memory.MemoryManager;
import com.phonepe.raciswarm.core.model.RaciRole;
import com.phonepe.raciswarm.core.routing.RoleBoundaries;
import com.phonepe.raciswarm.core.utils.SwarmUtils;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drives a single user turn of a conversation until control goes back to the user. One instance per turn, used by a
 * single thread holding the conversation's turn lock.
 */
@Slf4j
class TurnDriver {
    private record Draft(
            String senderId,
            String recipientId,
            EnvelopeKind kind,
            String content,
            long replyTo,
            ErrorType errorType) {
    }

    private final Conversation conversation;
    private final OrchestratorSetup setup;
    private final AgentInvoker invoker;
    private final MemoryManager memory;
    private final EventBus eventBus;
    private final int turn;
    private final long deadline;

    private ResponseStatus status = ResponseStatus.COMPLETED;
    private SwarmError error = SwarmError.success();
    private boolean closed;

    @Builder
    TurnDriver(
            Conversation conversation,
            OrchestratorSetup setup,
            AgentInvoker invoker,
            MemoryManager memory,
            EventBus eventBus,
            int turn) {
        this.conversation = conversation;
        this.setup = setup;
        this.invoker = invoker;
        this.memory = memory;
        this.eventBus = eventBus;
        this.turn = turn;
        this.deadline = System.nanoTime() + setup.getConversationTimeout().toNanos();
    }

    SwarmResponse run(String userId, String text) {
        try {
            final var request = deliver(new Draft(SwarmUtils.userSender(userId),
                                                  conversation.initializerId(),
                                                  EnvelopeKind.USER_REQUEST,
                                                  text,
                                                  0,
                                                  null));
            if (request.isEmpty()) {
                return closedResponse();
            }
            conversation.getInbox().offer(Delivery.of(request.get()));
            return drive();
        }
        catch (SwarmException e) {
            log.error("Error driving conversation {}: {}", conversation.getId(), e.getMessage());
            return degrade(e.getError());
        }
        catch (RuntimeException e) {
            log.error("Unexpected error driving conversation " + conversation.getId(), e);
            return degrade(SwarmError.error(ErrorType.INTERNAL_ERROR, e.getMessage()));
        }
    }

    private SwarmResponse drive() {
        final var inbox = conversation.getInbox();
        while (true) {
            if (closed || conversation.isClosed()) {
                return closedResponse();
            }
            if (System.nanoTime() > deadline) {
                log.warn("Conversation {} did not finish turn {} within {}",
                         conversation.getId(), turn, setup.getConversationTimeout());
                return degrade(SwarmError.error(ErrorType.CONVERSATION_TIMEOUT,
                                                conversation.getId(), setup.getConversationTimeout()));
            }
            final var next = inbox.poll().orElse(null);
            if (null == next) {
                return degrade(SwarmError.error(ErrorType.INTERNAL_ERROR,
                                                "Nothing left to deliver before the turn completed"));
            }
            final var terminal = process(next);
            if (terminal.isPresent()) {
                return completed(terminal.get());
            }
        }
    }

    private Optional<MessageEnvelope> process(Delivery delivery) {
        final var envelope = delivery.envelope();
        final var agent = conversation.getSwarm()
                .member(envelope.getRecipientId())
                .orElseThrow(() -> new SwarmException(ErrorType.UNKNOWN_RECIPIENT,
                                                      envelope.getSenderId(), envelope.getRecipientId()));
        final var outcome = invoker.invoke(agent, invocation(agent, envelope));
        if (!outcome.isSuccess()) {
            eventBus.notify(HopFailedEvent.builder()
                                    .conversationId(conversation.getId())
                                    .agentId(agent.id())
                                    .errorType(outcome.getError().getErrorType())
                                    .message(outcome.getError().getMessage())
                                    .attempts(outcome.getAttempts())
                                    .build());
        }
        if (agent.role() == RaciRole.RESPONSIBLE) {
            return forwardToAdmin(agent, delivery, outcome);
        }
        if (!outcome.isSuccess()) {
            return failure(agent, delivery, outcome.getError());
        }
        return outcome.getReply().accept(new AgentReplyVisitor<Optional<MessageEnvelope>>() {
            @Override
            public Optional<MessageEnvelope> visit(Answer answer) {
                return respond(new Draft(agent.id(),
                                         delivery.origin().getSenderId(),
                                         EnvelopeKind.ANSWER,
                                         answer.getContent(),
                                         delivery.origin().getSequenceNo(),
                                         null));
            }

            @Override
            public Optional<MessageEnvelope> visit(Delegation delegation) {
                return delegate(agent, delivery, delegation);
            }
        });
    }

    /*
     * Whatever the initializer comes up with goes to the admin, which owns the outcome.
     */
    private Optional<MessageEnvelope> forwardToAdmin(SwarmAgent initializer, Delivery delivery, HopOutcome outcome) {
        final Draft draft;
        if (outcome.isSuccess()) {
            final var content = outcome.getReply().accept(new AgentReplyVisitor<String>() {
                @Override
                public String visit(Answer answer) {
                    return answer.getContent();
                }

                @Override
                public String visit(Delegation delegation) {
                    final var targetId = delegation.getTargetAgentId();
                    if ((targetId != null && !targetId.equals(conversation.adminId()))
                            || (targetId == null && delegation.getTargetRole() != RaciRole.ACCOUNTABLE)) {
                        log.warn("{}. Forwarding to {} instead.",
                                 SwarmError.error(ErrorType.ROLE_VIOLATION,
                                                  initializer.id(),
                                                  initializer.role(),
                                                  null != targetId ? targetId : delegation.getTargetRole())
                                         .getMessage(),
                                 conversation.adminId());
                    }
                    return delegation.getSubGoal();
                }
            });
            draft = new Draft(initializer.id(), conversation.adminId(), EnvelopeKind.DELEGATION, content,
                              delivery.envelope().getSequenceNo(), null);
        }
        else {
            draft = new Draft(initializer.id(), conversation.adminId(), EnvelopeKind.FAILURE,
                              outcome.getError().getMessage(), delivery.envelope().getSequenceNo(),
                              outcome.getError().getErrorType());
        }
        final var forwarded = deliver(draft);
        if (forwarded.isEmpty() || forwarded.get().isTerminal()) {
            return forwarded.filter(MessageEnvelope::isTerminal);
        }
        conversation.getTracker().open(initializer.id(), delivery.origin(),
                                       List.of(forwarded.get().getSequenceNo()));
        conversation.getInbox().offer(Delivery.of(forwarded.get()));
        return Optional.empty();
    }

    private Optional<MessageEnvelope> delegate(SwarmAgent delegator, Delivery delivery, Delegation delegation) {
        final var route = RoleBoundaries.route(conversation.getSwarm(), delegator, delegation);
        if (route.isRejected()) {
            log.warn("Rejected delegation in conversation {}: {}", conversation.getId(), route.error().getMessage());
            return failure(delegator, delivery, route.error());
        }
        final var sent = new ArrayList<MessageEnvelope>();
        for (final var target : route.targets()) {
            final var envelope = deliver(new Draft(delegator.id(),
                                                   target.id(),
                                                   EnvelopeKind.DELEGATION,
                                                   delegation.getSubGoal(),
                                                   delivery.envelope().getSequenceNo(),
                                                   null));
            if (envelope.isEmpty() || envelope.get().isTerminal()) {
                return envelope.filter(MessageEnvelope::isTerminal);
            }
            sent.add(envelope.get());
        }
        conversation.getTracker().open(delegator.id(),
                                       delivery.origin(),
                                       sent.stream().map(MessageEnvelope::getSequenceNo).toList());
        sent.forEach(envelope -> conversation.getInbox().offer(Delivery.of(envelope)));
        return Optional.empty();
    }

    private Optional<MessageEnvelope> failure(SwarmAgent agent, Delivery delivery, SwarmError failure) {
        return respond(new Draft(agent.id(),
                                 delivery.origin().getSenderId(),
                                 EnvelopeKind.FAILURE,
                                 failure.getMessage(),
                                 delivery.origin().getSequenceNo(),
                                 failure.getErrorType()));
    }

    /*
     * Answers and failures close one delegation. The delegator only gets to act again once all delegations it sent
     * in that round are answered, and then reacts to the last answer.
     */
    private Optional<MessageEnvelope> respond(Draft draft) {
        final var tracker = conversation.getTracker();
        final var completed = tracker.answer(draft.replyTo());
        if (draft.recipientId().equals(conversation.initializerId()) && tracker.hasOutstanding()) {
            log.warn("Conversation {} returning to {} with {} delegations unanswered. Dropping them.",
                     conversation.getId(), conversation.initializerId(), tracker.outstandingCount());
            tracker.clear();
            conversation.getInbox().clear();
        }
        final var envelope = deliver(draft);
        if (envelope.isEmpty() || envelope.get().isTerminal()) {
            return envelope.filter(MessageEnvelope::isTerminal);
        }
        completed.map(DelegationFrame::getOrigin)
                .ifPresent(origin -> conversation.getInbox().offer(new Delivery(envelope.get(), origin)));
        return Optional.empty();
    }

    /*
     * Stamps and records an envelope. A non terminal envelope that would reach the hop ceiling is replaced by the
     * fallback hand-off. Returns empty if the conversation got closed in the meantime.
     */
    private Optional<MessageEnvelope> deliver(Draft draft) {
        final var userRequest = draft.kind() == EnvelopeKind.USER_REQUEST;
        final var hop = userRequest ? 0 : conversation.nextHop();
        var effective = draft;
        var pending = pendingUserReply(effective);
        if (!userRequest && !Boolean.TRUE.equals(pending) && hop >= setup.getHopCeiling()) {
            log.warn("Conversation {} reached the hop ceiling of {} in turn {}",
                     conversation.getId(), setup.getHopCeiling(), turn);
            effective = fallbackDraft();
            conversation.getTracker().clear();
            conversation.getInbox().clear();
            pending = pendingUserReply(effective);
            status = ResponseStatus.FALLBACK;
            error = SwarmError.error(ErrorType.DELEGATION_DEPTH_EXCEEDED, setup.getHopCeiling());
        }
        final var envelope = MessageEnvelope.builder()
                .conversationId(conversation.getId())
                .senderId(effective.senderId())
                .recipientId(effective.recipientId())
                .kind(effective.kind())
                .content(effective.content())
                .pendingUserReply(pending)
                .sequenceNo(conversation.nextSequenceNo())
                .hop(hop)
                .turn(turn)
                .replyTo(effective.replyTo())
                .errorType(effective.errorType())
                .build();
        final var transition = conversation.apply(envelope).orElse(null);
        if (null == transition) {
            log.info("Conversation {} is closed. Archiving envelope {} without routing it.",
                     conversation.getId(), envelope.getSequenceNo());
            memory.admitLate(envelope);
            closed = true;
            return Optional.empty();
        }
        memory.admit(envelope);
        log.debug("Conversation {} envelope {}: {} -> {} ({}, hop {}, pending_user_reply {})",
                  conversation.getId(), envelope.getSequenceNo(), envelope.getSenderId(),
                  envelope.getRecipientId(), envelope.getKind(), hop, pending);
        eventBus.notify(EnvelopeDeliveredEvent.builder()
                                .conversationId(conversation.getId())
                                .envelope(envelope)
                                .build());
        if (transition.isChange()) {
            eventBus.notify(StateTransitionEvent.builder()
                                    .conversationId(conversation.getId())
                                    .fromState(transition.from())
                                    .toState(transition.to())
                                    .sequenceNo(transition.sequenceNo())
                                    .build());
        }
        return Optional.of(envelope);
    }

    private Boolean pendingUserReply(Draft draft) {
        return ConversationStateMachine.pendingUserReply(draft.kind(),
                                                         draft.recipientId(),
                                                         conversation.initializerId(),
                                                         conversation.getTracker().hasOutstanding());
    }

    private Draft fallbackDraft() {
        final var progress = memory.project(conversation.getId(), RaciRole.ACCOUNTABLE).render();
        final var content = SwarmUtils.abbreviate(
                "%s. Partial progress so far:%n%s".formatted(
                        SwarmError.error(ErrorType.DELEGATION_DEPTH_EXCEEDED, setup.getHopCeiling()).getMessage(),
                        progress),
                setup.getMemorySetup().getMaxSummaryLength());
        return new Draft(conversation.adminId(), conversation.initializerId(), EnvelopeKind.FALLBACK, content, 0,
                         ErrorType.DELEGATION_DEPTH_EXCEEDED);
    }

    /*
     * The user gets a generic message. The underlying error stays in the envelope and the response error.
     */
    private SwarmResponse degrade(SwarmError cause) {
        status = ResponseStatus.DEGRADED;
        error = cause;
        if (closed || conversation.isClosed()) {
            return closedResponse();
        }
        conversation.getTracker().clear();
        conversation.getInbox().clear();
        try {
            final var terminal = deliver(new Draft(conversation.adminId(),
                                                   conversation.initializerId(),
                                                   EnvelopeKind.FALLBACK,
                                                   setup.getDegradedMessage(),
                                                   0,
                                                   cause.getErrorType()));
            if (terminal.isEmpty()) {
                return closedResponse();
            }
            return response(terminal.get(), setup.getDegradedMessage());
        }
        catch (SwarmException e) {
            log.error("Could not hand conversation {} back to the user: {}", conversation.getId(), e.getMessage());
            return response(null, setup.getDegradedMessage());
        }
    }

    private SwarmResponse completed(MessageEnvelope terminal) {
        if (terminal.getKind() == EnvelopeKind.FAILURE) {
            status = ResponseStatus.DEGRADED;
            error = new SwarmError(terminal.getErrorType(), terminal.getContent());
            return response(terminal, setup.getDegradedMessage());
        }
        return response(terminal, terminal.getContent());
    }

    private SwarmResponse closedResponse() {
        return SwarmResponse.builder()
                .conversationId(conversation.getId())
                .turn(turn)
                .status(ResponseStatus.CLOSED)
                .error(SwarmError.error(ErrorType.CONVERSATION_CLOSED, conversation.getId()))
                .build();
    }

    private SwarmResponse response(MessageEnvelope terminal, String content) {
        return SwarmResponse.builder()
                .conversationId(conversation.getId())
                .turn(turn)
                .status(status)
                .content(content)
                .terminalEnvelope(terminal)
                .error(error)
                .build();
    }

    private AgentInvocation invocation(SwarmAgent agent, MessageEnvelope envelope) {
        return AgentInvocation.builder()
                .conversationId(conversation.getId())
                .userId(conversation.getUserId())
                .swarmName(conversation.getSwarmName())
                .turn(turn)
                .envelope(envelope)
                .context(memory.project(conversation.getId(), agent.role()))
                .roster(conversation.getSwarm().roster())
                .build();
    }
}
