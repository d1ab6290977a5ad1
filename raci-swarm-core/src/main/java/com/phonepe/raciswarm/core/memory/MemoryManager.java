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

package com.phonepe.raciswarm.core.memory;

import com.google.common.base.Preconditions;
import com.phonepe.raciswarm.core.archive.ArchivedConversation;
import com.phonepe.raciswarm.core.archive.ConversationArchive;
import com.phonepe.raciswarm.core.archive.InMemoryConversationArchive;
import com.phonepe.raciswarm.core.envelope.EnvelopeKind;
import com.phonepe.raciswarm.core.envelope.MessageEnvelope;
import com.phonepe.raciswarm.core.errors.ErrorType;
import com.phonepe.raciswarm.core.errors.SwarmError;
import com.phonepe.raciswarm.core.events.EventBus;
import com.phonepe.raciswarm.core.events.MemoryCompactedEvent;
import com.phonepe.raciswarm.core.model.RaciRole;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded working memory for live conversations.
 * <p>
 * Every delivered envelope is admitted as a fragment. When the retained size goes over the budget, the lowest scoring
 * fragments are merged into a summary. Agents never see the whole history; {@link #project(String, RaciRole)} hands
 * out only the fragments relevant to the caller's role. Calls for different conversations never block each other.
 */
@Slf4j
public class MemoryManager {
    private record LiveConversation(ConversationMemory memory, Map<String, RaciRole> roles) {
    }

    private final MemorySetup setup;
    private final Summarizer summarizer;
    private final FragmentScorer scorer;
    private final ConversationArchive archive;
    private final EventBus eventBus;
    private final Map<String, LiveConversation> live = new ConcurrentHashMap<>();

    public MemoryManager() {
        this(null, null, null, null, null);
    }

    @Builder
    public MemoryManager(
            MemorySetup setup,
            Summarizer summarizer,
            FragmentScorer scorer,
            ConversationArchive archive,
            EventBus eventBus) {
        this.setup = Objects.requireNonNullElse(setup, MemorySetup.DEFAULT);
        Preconditions.checkArgument(this.setup.getBudget() > 0, "Memory budget must be positive");
        this.summarizer = Objects.requireNonNullElseGet(summarizer, ExcerptSummarizer::new);
        this.scorer = Objects.requireNonNullElseGet(
                scorer,
                () -> new RecencyRelevanceScorer(this.setup.getRecencyWeight(), this.setup.getRelevanceWeight()));
        this.archive = Objects.requireNonNullElseGet(archive, InMemoryConversationArchive::new);
        this.eventBus = eventBus;
    }

    /**
     * Start tracking memory for a conversation. Calling this for an already open conversation has no effect.
     *
     * @param conversationId Conversation id
     * @param memberRoles    Role of every agent taking part, by agent id. Used to decide who gets to see what.
     */
    public void open(String conversationId, Map<String, RaciRole> memberRoles) {
        live.computeIfAbsent(conversationId,
                             id -> new LiveConversation(new ConversationMemory(id, setup, summarizer, scorer),
                                                        Map.copyOf(memberRoles)));
    }

    /**
     * Append an envelope to the working memory of its conversation. The envelope must already be part of the
     * conversation history. If the conversation was released in the meantime, the archived history carries it and it
     * is not admitted again. Envelopes recorded after close go through {@link #admitLate(MessageEnvelope)}.
     *
     * @return true if the envelope went into working memory, false if the conversation was no longer live
     */
    public boolean admit(MessageEnvelope envelope) {
        final var conversation = live.get(envelope.getConversationId());
        if (null == conversation) {
            return notLive(envelope);
        }
        final var memory = conversation.memory();
        final Optional<ConversationMemory.Compaction> compaction;
        synchronized (memory) {
            if (memory.isReleased()) {
                return notLive(envelope);
            }
            compaction = memory.admit(toFragment(envelope, conversation.roles()));
        }
        compaction.ifPresent(result -> onCompaction(envelope.getConversationId(), result));
        return true;
    }

    /**
     * Send an envelope straight to the archive. Used for envelopes produced after their conversation was closed, which
     * must not show up in working memory any more.
     */
    public void admitLate(MessageEnvelope envelope) {
        appendLate(envelope);
    }

    /**
     * The slice of memory an agent with the given role may see. Repeated calls without an admission in between return
     * equal slices.
     */
    public ContextSlice project(String conversationId, RaciRole role) {
        final var conversation = live.get(conversationId);
        if (null == conversation) {
            return ContextSlice.empty(conversationId, role);
        }
        final var memory = conversation.memory();
        synchronized (memory) {
            return memory.project(role);
        }
    }

    public Optional<MemorySnapshot> snapshot(String conversationId) {
        return Optional.ofNullable(live.get(conversationId))
                .map(conversation -> {
                    final var memory = conversation.memory();
                    synchronized (memory) {
                        return memory.snapshot();
                    }
                });
    }

    /**
     * Archived record of a released conversation
     */
    public Optional<ArchivedConversation> archived(String conversationId) {
        return archive.read(conversationId);
    }

    public boolean isLive(String conversationId) {
        return live.containsKey(conversationId);
    }

    /**
     * Stop tracking a conversation and hand it over to the archive along with its final memory snapshot. Anything
     * admitted after this goes straight to the archive.
     *
     * @param conversation Archive record, without snapshot
     * @return The archived record, empty if the conversation was not live
     */
    public Optional<ArchivedConversation> release(ArchivedConversation conversation) {
        final var conversationId = conversation.getConversationId();
        final var liveConversation = live.get(conversationId);
        if (null == liveConversation) {
            return Optional.empty();
        }
        final var memory = liveConversation.memory();
        final ArchivedConversation archived;
        synchronized (memory) {
            if (memory.isReleased()) {
                return Optional.empty();
            }
            archived = conversation.withSnapshot(memory.snapshot());
            if (!archive.archive(archived)) {
                log.warn("Archive refused conversation {}", conversationId);
            }
            memory.markReleased();
        }
        live.remove(conversationId);
        log.info("Released memory for conversation {}", conversationId);
        return Optional.of(archived);
    }

    private static boolean notLive(MessageEnvelope envelope) {
        log.debug("Conversation {} is not live. Envelope {} stays with its archived history.",
                  envelope.getConversationId(), envelope.getSequenceNo());
        return false;
    }

    private boolean appendLate(MessageEnvelope envelope) {
        log.info("Envelope {} for conversation {} arrived after close. Sending to archive.",
                 envelope.getSequenceNo(), envelope.getConversationId());
        if (!archive.appendLate(envelope)) {
            log.warn("Archive refused late envelope {} for conversation {}",
                     envelope.getEnvelopeId(), envelope.getConversationId());
        }
        return false;
    }

    private void onCompaction(String conversationId, ConversationMemory.Compaction result) {
        final var error = SwarmError.error(ErrorType.MEMORY_BUDGET_EXCEEDED, setup.getBudget(), conversationId);
        if (result.touchedPinned()) {
            log.warn("{}. Recovered by summarizing pinned fragments too.", error.getMessage());
        }
        else {
            log.debug("{}. Recovered by summarizing {} fragments.", error.getMessage(), result.mergedFragments());
        }
        if (null != eventBus) {
            eventBus.notify(MemoryCompactedEvent.builder()
                                    .conversationId(conversationId)
                                    .mergedFragments(result.mergedFragments())
                                    .sizeBefore(result.sizeBefore())
                                    .sizeAfter(result.sizeAfter())
                                    .budget(setup.getBudget())
                                    .build());
        }
    }

    private static MemoryFragment toFragment(MessageEnvelope envelope, Map<String, RaciRole> roles) {
        final var content = Objects.requireNonNullElse(envelope.getContent(), "");
        final var userRequest = envelope.getKind() == EnvelopeKind.USER_REQUEST;
        return MemoryFragment.builder()
                .fragmentId(envelope.getEnvelopeId())
                .kind(FragmentKind.ENVELOPE)
                .sequenceFrom(envelope.getSequenceNo())
                .sequenceTo(envelope.getSequenceNo())
                .senderId(envelope.getSenderId())
                .recipientId(envelope.getRecipientId())
                .envelopeKind(envelope.getKind())
                .content(content)
                .size(content.length())
                .pinned(userRequest)
                .relevantRoles(relevantRoles(envelope, roles, userRequest))
                .envelopeCount(1)
                .build();
    }

    private static Set<RaciRole> relevantRoles(
            MessageEnvelope envelope,
            Map<String, RaciRole> roles,
            boolean userRequest) {
        if (userRequest) {
            return Collections.unmodifiableSet(EnumSet.allOf(RaciRole.class));
        }
        final var relevant = EnumSet.noneOf(RaciRole.class);
        Optional.ofNullable(roles.get(envelope.getSenderId())).ifPresent(relevant::add);
        Optional.ofNullable(roles.get(envelope.getRecipientId())).ifPresent(relevant::add);
        return Collections.unmodifiableSet(relevant);
    }
}
