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

import com.phonepe.raciswarm.core.model.RaciRole;
import com.phonepe.raciswarm.core.utils.SwarmUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.IntStream;

/**
 * Working memory of a single conversation. Not thread safe; {@link MemoryManager} synchronizes on the instance.
 */
@Slf4j
class ConversationMemory {
    record Compaction(int mergedFragments, int sizeBefore, int sizeAfter, boolean touchedPinned) {
    }

    private record Ranked(int position, MemoryFragment fragment, double score) {
    }

    @Getter
    private final String conversationId;
    private final MemorySetup setup;
    private final Summarizer summarizer;
    private final FragmentScorer scorer;
    private final List<MemoryFragment> fragments = new ArrayList<>();
    private int totalSize;
    private long version;
    private int compactions;
    @Getter
    private boolean released;

    ConversationMemory(
            String conversationId,
            MemorySetup setup,
            Summarizer summarizer,
            FragmentScorer scorer) {
        this.conversationId = conversationId;
        this.setup = setup;
        this.summarizer = summarizer;
        this.scorer = scorer;
    }

    Optional<Compaction> admit(MemoryFragment fragment) {
        fragments.add(fragment);
        totalSize += fragment.getSize();
        version++;
        if (totalSize <= setup.getBudget()) {
            return Optional.empty();
        }
        return Optional.of(compact());
    }

    ContextSlice project(RaciRole role) {
        final var visible = fragments.stream()
                .filter(fragment -> fragment.isVisibleTo(role))
                .toList();
        return new ContextSlice(conversationId,
                                role,
                                visible,
                                visible.stream().mapToInt(MemoryFragment::getSize).sum(),
                                version);
    }

    MemorySnapshot snapshot() {
        return MemorySnapshot.builder()
                .conversationId(conversationId)
                .fragments(List.copyOf(fragments))
                .totalSize(totalSize)
                .budget(setup.getBudget())
                .version(version)
                .compactions(compactions)
                .build();
    }

    void markReleased() {
        released = true;
    }

    /*
     * Picks the lowest scoring fragments until enough room is left for a summary, merges them and puts the summary
     * where the oldest merged fragment used to be. Pinned fragments are used only when nothing else is left.
     */
    private Compaction compact() {
        final var budget = setup.getBudget();
        final var sizeBefore = totalSize;
        final var count = fragments.size();
        final var ranked = IntStream.range(0, count)
                .mapToObj(position -> new Ranked(position,
                                                 fragments.get(position),
                                                 scorer.score(fragments.get(position), position, count)))
                .toList();
        final var candidates = new ArrayList<Ranked>();
        ranked.stream()
                .filter(r -> !r.fragment().isPinned())
                .sorted(Comparator.comparingDouble(Ranked::score).thenComparingInt(Ranked::position))
                .forEach(candidates::add);
        ranked.stream()
                .filter(r -> r.fragment().isPinned())
                .forEach(candidates::add);

        final var reserve = Math.min(setup.getMaxSummaryLength(), budget / 4);
        final var selected = new TreeSet<Integer>();
        var remaining = totalSize;
        var touchedPinned = false;
        for (final var candidate : candidates) {
            if (!selected.isEmpty() && remaining + reserve <= budget) {
                break;
            }
            selected.add(candidate.position());
            remaining -= candidate.fragment().getSize();
            touchedPinned |= candidate.fragment().isPinned();
        }
        final var merged = selected.stream().map(fragments::get).toList();
        final var summaryLength = Math.min(setup.getMaxSummaryLength(), budget - remaining);
        final var summaryText = SwarmUtils.abbreviate(summarizer.summarize(merged, summaryLength), summaryLength);

        final var compacted = new ArrayList<MemoryFragment>(count - selected.size() + 1);
        final int first = selected.first();
        for (int position = 0; position < count; position++) {
            if (!selected.contains(position)) {
                compacted.add(fragments.get(position));
            }
            else if (position == first && !summaryText.isEmpty()) {
                compacted.add(summaryOf(merged, summaryText, touchedPinned));
            }
        }
        fragments.clear();
        fragments.addAll(compacted);
        totalSize = compacted.stream().mapToInt(MemoryFragment::getSize).sum();
        compactions++;
        log.debug("Compacted memory for conversation {}: {} fragments merged, size {} -> {} (budget {})",
                  conversationId, merged.size(), sizeBefore, totalSize, budget);
        return new Compaction(merged.size(), sizeBefore, totalSize, touchedPinned);
    }

    private static MemoryFragment summaryOf(List<MemoryFragment> merged, String text, boolean pinned) {
        final var roles = EnumSet.noneOf(RaciRole.class);
        merged.forEach(fragment -> roles.addAll(fragment.getRelevantRoles()));
        return MemoryFragment.builder()
                .fragmentId(SwarmUtils.newId())
                .kind(FragmentKind.SUMMARY)
                .sequenceFrom(merged.stream().mapToLong(MemoryFragment::getSequenceFrom).min().orElse(0))
                .sequenceTo(merged.stream().mapToLong(MemoryFragment::getSequenceTo).max().orElse(0))
                .content(text)
                .size(text.length())
                .pinned(pinned)
                .relevantRoles(Collections.unmodifiableSet(roles))
                .envelopeCount(merged.stream().mapToInt(MemoryFragment::getEnvelopeCount).sum())
                .build();
    }
}
