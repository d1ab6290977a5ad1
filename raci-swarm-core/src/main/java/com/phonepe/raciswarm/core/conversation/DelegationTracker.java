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
import com.phonepe.raciswarm.core.envelope.MessageEnvelope;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps track of delegations waiting for answers inside a turn. Supports any nesting depth: each delegating agent gets
 * its own frame.
 */
public class DelegationTracker {
    private final Map<Long, DelegationFrame> byDelegation = new HashMap<>();

    /**
     * Record delegations sent by an agent
     *
     * @param delegatorId Agent that delegated
     * @param origin      Envelope the agent was handling when it delegated
     * @param delegations Sequence numbers of the delegation envelopes
     */
    public DelegationFrame open(String delegatorId, MessageEnvelope origin, Collection<Long> delegations) {
        Preconditions.checkArgument(!delegations.isEmpty(), "A frame needs at least one delegation");
        final var frame = new DelegationFrame(delegatorId, origin, delegations);
        delegations.forEach(sequenceNo -> byDelegation.put(sequenceNo, frame));
        return frame;
    }

    /**
     * Record an answer to a delegation
     *
     * @param delegationSequenceNo Sequence number of the delegation envelope being answered
     * @return The frame, if this was the last answer it was waiting for
     */
    public Optional<DelegationFrame> answer(long delegationSequenceNo) {
        final var frame = byDelegation.remove(delegationSequenceNo);
        if (null == frame || !frame.answer(delegationSequenceNo)) {
            return Optional.empty();
        }
        return frame.isComplete() ? Optional.of(frame) : Optional.empty();
    }

    public boolean isAwaiting(long delegationSequenceNo) {
        return byDelegation.containsKey(delegationSequenceNo);
    }

    public boolean hasOutstanding() {
        return !byDelegation.isEmpty();
    }

    public int outstandingCount() {
        return byDelegation.size();
    }

    public void clear() {
        byDelegation.clear();
    }
}
