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

import com.phonepe.raciswarm.core.errors.ErrorType;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Retry behaviour for a single agent hop
 */
@Value
@With
public class HopRetrySetup {
    public static final int DEFAULT_TOTAL_ATTEMPTS = 2;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(200);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(2);
    public static final Set<ErrorType> DEFAULT_RETRYABLE_ERROR_TYPES = Arrays.stream(ErrorType.values())
            .filter(ErrorType::isRetryable)
            .collect(Collectors.toUnmodifiableSet());
    public static final HopRetrySetup DEFAULT = HopRetrySetup.builder().build();

    /**
     * Attempts in total, the first call included
     */
    int totalAttempts;

    /**
     * Wait before the first retry. Doubles for every further retry, up to {@link #maxDelay}.
     */
    Duration initialDelay;

    Duration maxDelay;

    /**
     * Errors that get retried. Defaults to the ones marked retryable in {@link ErrorType}.
     */
    Set<ErrorType> retriableErrorTypes;

    @Builder
    public HopRetrySetup(
            int totalAttempts,
            Duration initialDelay,
            Duration maxDelay,
            Set<ErrorType> retriableErrorTypes) {
        this.totalAttempts = totalAttempts <= 0 ? DEFAULT_TOTAL_ATTEMPTS : totalAttempts;
        this.initialDelay = isPositive(initialDelay) ? initialDelay : DEFAULT_INITIAL_DELAY;
        final var max = Objects.requireNonNullElse(maxDelay, DEFAULT_MAX_DELAY);
        this.maxDelay = max.compareTo(this.initialDelay) > 0 ? max : this.initialDelay.multipliedBy(2);
        this.retriableErrorTypes = Objects.requireNonNullElse(retriableErrorTypes, DEFAULT_RETRYABLE_ERROR_TYPES);
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isZero() && !duration.isNegative();
    }
}
