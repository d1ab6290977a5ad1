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

package com.phonepe.raciswarm.configured;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phonepe.raciswarm.core.memory.MemorySetup;
import com.phonepe.raciswarm.core.orchestrator.HopRetrySetup;
import com.phonepe.raciswarm.core.orchestrator.OrchestratorSetup;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Orchestrator limits as written in configuration. Anything left out falls back to the defaults in
 * {@link OrchestratorSetup}, {@link HopRetrySetup} and {@link MemorySetup}. Durations use ISO-8601 notation
 * (PT30S) or plain seconds.
 */
@Value
@Builder
@Jacksonized
public class OrchestratorSettings {
    public static final OrchestratorSettings DEFAULT = OrchestratorSettings.builder().build();

    @JsonProperty("hop_ceiling")
    Integer hopCeiling;

    @JsonProperty("hop_timeout")
    Duration hopTimeout;

    @JsonProperty("retry_attempts")
    Integer retryAttempts;

    @JsonProperty("retry_initial_delay")
    Duration retryInitialDelay;

    @JsonProperty("retry_max_delay")
    Duration retryMaxDelay;

    @JsonProperty("conversation_timeout")
    Duration conversationTimeout;

    @JsonProperty("inactivity_timeout")
    Duration inactivityTimeout;

    @JsonProperty("sweep_interval")
    Duration sweepInterval;

    @JsonProperty("memory_budget")
    Integer memoryBudget;

    @JsonProperty("max_summary_length")
    Integer maxSummaryLength;

    @JsonProperty("degraded_message")
    String degradedMessage;

    List<String> validate() {
        final var problems = new ArrayList<String>();
        positive("hop_ceiling", hopCeiling, problems);
        positive("retry_attempts", retryAttempts, problems);
        positive("memory_budget", memoryBudget, problems);
        positive("max_summary_length", maxSummaryLength, problems);
        positive("hop_timeout", hopTimeout, problems);
        positive("retry_initial_delay", retryInitialDelay, problems);
        positive("retry_max_delay", retryMaxDelay, problems);
        positive("conversation_timeout", conversationTimeout, problems);
        positive("inactivity_timeout", inactivityTimeout, problems);
        positive("sweep_interval", sweepInterval, problems);
        return problems;
    }

    public OrchestratorSetup toSetup() {
        final var memory = MemorySetup.DEFAULT
                .withBudget(Objects.requireNonNullElse(memoryBudget, MemorySetup.DEFAULT.getBudget()))
                .withMaxSummaryLength(Objects.requireNonNullElse(maxSummaryLength,
                                                                 MemorySetup.DEFAULT.getMaxSummaryLength()));
        return OrchestratorSetup.builder()
                .hopCeiling(Objects.requireNonNullElse(hopCeiling, 0))
                .hopTimeout(hopTimeout)
                .retrySetup(HopRetrySetup.builder()
                                    .totalAttempts(Objects.requireNonNullElse(retryAttempts, 0))
                                    .initialDelay(retryInitialDelay)
                                    .maxDelay(retryMaxDelay)
                                    .build())
                .conversationTimeout(conversationTimeout)
                .inactivityTimeout(inactivityTimeout)
                .sweepInterval(sweepInterval)
                .memorySetup(memory)
                .degradedMessage(degradedMessage)
                .build();
    }

    private static void positive(String name, Integer value, List<String> problems) {
        if (null != value && value <= 0) {
            problems.add("orchestrator." + name + " must be positive, found " + value);
        }
    }

    private static void positive(String name, Duration value, List<String> problems) {
        if (null != value && (value.isZero() || value.isNegative())) {
            problems.add("orchestrator." + name + " must be positive, found " + value);
        }
    }
}
