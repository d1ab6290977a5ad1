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

/**
 * Weighted mix of how recent a fragment is and how many roles it matters to
 */
public class RecencyRelevanceScorer implements FragmentScorer {
    private static final double ROLE_COUNT = RaciRole.values().length;

    private final double recencyWeight;
    private final double relevanceWeight;

    public RecencyRelevanceScorer(double recencyWeight, double relevanceWeight) {
        this.recencyWeight = recencyWeight;
        this.relevanceWeight = relevanceWeight;
    }

    @Override
    public double score(MemoryFragment fragment, int position, int count) {
        final var recency = count <= 1 ? 1.0 : (double) position / (count - 1);
        final var relevance = fragment.getRelevantRoles().size() / ROLE_COUNT;
        return recencyWeight * recency + relevanceWeight * relevance;
    }
}
