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

import com.phonepe.raciswarm.core.memory.MemorySetup;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Limits and timeouts used while driving conversations
 */
@Value
@With
public class OrchestratorSetup {
    public static final int DEFAULT_HOP_CEILING = 10;
    public static final Duration DEFAULT_HOP_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CONVERSATION_TIMEOUT = Duration.ofMinutes(5);
    public static final Duration DEFAULT_INACTIVITY_TIMEOUT = Duration.ofMinutes(30);
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(1);
    public static final String DEFAULT_DEGRADED_MESSAGE =
            "We could not complete your request right now. Please try again in a little while.";
    public static final OrchestratorSetup DEFAULT = OrchestratorSetup.builder().build();

    /**
     * Agent to agent hops allowed in one turn. The hop that reaches it becomes a fallback hand-off to the user.
     */
    int hopCeiling;

    /**
     * Time an agent gets to respond, per attempt
     */
    Duration hopTimeout;

    HopRetrySetup retrySetup;

    /**
     * Time a single turn may take before the user gets a degraded response
     */
    Duration conversationTimeout;

    /**
     * Conversations waiting on the user longer than this get closed by the sweeper
     */
    Duration inactivityTimeout;

    Duration sweepInterval;

    MemorySetup memorySetup;

    /**
     * Text shown to the user when a turn cannot complete normally
     */
    String degradedMessage;

    /**
     * Runs asynchronous turns. A cached thread pool is used when not provided.
     */
    ExecutorService executorService;

    /**
     * Runs agent calls. Keep it apart from {@link #executorService}, turns block while their agents run. A cached
     * thread pool is used when not provided.
     */
    ExecutorService agentExecutorService;

    @Builder
    public OrchestratorSetup(
            int hopCeiling,
            Duration hopTimeout,
            HopRetrySetup retrySetup,
            Duration conversationTimeout,
            Duration inactivityTimeout,
            Duration sweepInterval,
            MemorySetup memorySetup,
            String degradedMessage,
            ExecutorService executorService,
            ExecutorService agentExecutorService) {
        this.hopCeiling = hopCeiling <= 0 ? DEFAULT_HOP_CEILING : hopCeiling;
        this.hopTimeout = Objects.requireNonNullElse(hopTimeout, DEFAULT_HOP_TIMEOUT);
        this.retrySetup = Objects.requireNonNullElse(retrySetup, HopRetrySetup.DEFAULT);
        this.conversationTimeout = Objects.requireNonNullElse(conversationTimeout, DEFAULT_CONVERSATION_TIMEOUT);
        this.inactivityTimeout = Objects.requireNonNullElse(inactivityTimeout, DEFAULT_INACTIVITY_TIMEOUT);
        this.sweepInterval = Objects.requireNonNullElse(sweepInterval, DEFAULT_SWEEP_INTERVAL);
        this.memorySetup = Objects.requireNonNullElse(memorySetup, MemorySetup.DEFAULT);
        this.degradedMessage = Objects.requireNonNullElse(degradedMessage, DEFAULT_DEGRADED_MESSAGE);
        this.executorService = executorService;
        this.agentExecutorService = agentExecutorService;
    }
}
