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
import lombok.Getter;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Delegations sent out by one agent in one go, and still waiting for answers
 */
public class DelegationFrame {
    @Getter
    private final String delegatorId;
    /**
     * The envelope the delegator was working on when it delegated. Its sender gets the delegator's eventual answer.
     */
    @Getter
    private final MessageEnvelope origin;
    private final Set<Long> outstanding;

    DelegationFrame(String delegatorId, MessageEnvelope origin, Collection<Long> delegations) {
        this.delegatorId = delegatorId;
        this.origin = origin;
        this.outstanding = new TreeSet<>(delegations);
    }

    boolean answer(long delegationSequenceNo) {
        return outstanding.remove(delegationSequenceNo);
    }

    public boolean isComplete() {
        return outstanding.isEmpty();
    }

    public Set<Long> getOutstanding() {
        return Set.copyOf(outstanding);
    }
}
