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

import com.phonepe.raciswarm.core.envelope.EnvelopeKind;
import com.phonepe.raciswarm.core.model.RaciRole;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Set;

/**
 * One retained piece of conversation memory
 */
@Value
@Builder
@Jacksonized
public class MemoryFragment {
    String fragmentId;
    FragmentKind kind;
    /**
     * First and last envelope sequence numbers covered. Same for envelope fragments.
     */
    long sequenceFrom;
    long sequenceTo;
    String senderId;
    String recipientId;
    EnvelopeKind envelopeKind;
    String content;
    int size;
    /**
     * Pinned fragments are only merged into a summary when nothing else is left to merge
     */
    boolean pinned;
    /**
     * Roles whose agents get to see this fragment. Accountable agents see everything.
     */
    Set<RaciRole> relevantRoles;
    /**
     * Number of envelopes represented by this fragment
     */
    int envelopeCount;

    public boolean isVisibleTo(RaciRole role) {
        return role == RaciRole.ACCOUNTABLE || relevantRoles.contains(role);
    }
}
