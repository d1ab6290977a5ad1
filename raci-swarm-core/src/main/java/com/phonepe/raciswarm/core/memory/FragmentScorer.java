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

/**
 * Scores fragments for eviction. Lowest scores are merged first.
 */
@FunctionalInterface
public interface FragmentScorer {
    /**
     * @param fragment Fragment to score
     * @param position Position of the fragment in memory, 0 being the oldest
     * @param count    Number of fragments currently in memory
     * @return score; higher means more worth keeping
     */
    double score(MemoryFragment fragment, int position, int count);
}
