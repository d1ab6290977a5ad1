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

package com.phonepe.raciswarm.core.events;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Working memory went over budget and older fragments were merged
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class MemoryCompactedEvent extends SwarmEvent {
    int mergedFragments;
    int sizeBefore;
    int sizeAfter;
    int budget;

    @Builder
    @Jacksonized
    public MemoryCompactedEvent(
            @NonNull String conversationId,
            int mergedFragments,
            int sizeBefore,
            int sizeAfter,
            int budget) {
        super(SwarmEventType.MEMORY_COMPACTED, conversationId);
        this.mergedFragments = mergedFragments;
        this.sizeBefore = sizeBefore;
        this.sizeAfter = sizeAfter;
        this.budget = budget;
    }

    @Override
    public <T> T accept(SwarmEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
