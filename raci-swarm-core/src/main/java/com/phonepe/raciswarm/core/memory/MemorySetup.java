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

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Tuning for conversation memory. Sizes are measured in characters of content.
 */
@Value
@Builder
@With
public class MemorySetup {
    public static final int DEFAULT_BUDGET = 16_000;
    public static final int DEFAULT_MAX_SUMMARY_LENGTH = 2_000;
    public static final double DEFAULT_RECENCY_WEIGHT = 0.7;
    public static final double DEFAULT_RELEVANCE_WEIGHT = 0.3;

    public static final MemorySetup DEFAULT = MemorySetup.builder().build();

    /**
     * Upper limit on the retained size of a conversation's memory
     */
    @Builder.Default
    int budget = DEFAULT_BUDGET;

    /**
     * Upper limit on a single summary fragment
     */
    @Builder.Default
    int maxSummaryLength = DEFAULT_MAX_SUMMARY_LENGTH;

    @Builder.Default
    double recencyWeight = DEFAULT_RECENCY_WEIGHT;

    @Builder.Default
    double relevanceWeight = DEFAULT_RELEVANCE_WEIGHT;
}
