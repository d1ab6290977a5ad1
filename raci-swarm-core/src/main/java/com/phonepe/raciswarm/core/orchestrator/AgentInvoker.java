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

import com.phonepe.raciswarm.core.agent.AgentInvocation;
import com.phonepe.raciswarm.core.agent.AgentReply;
import com.phonepe.raciswarm.core.agent.SwarmAgent;
import com.phonepe.raciswarm.core.errors.ErrorType;
import com.phonepe.raciswarm.core.errors.SwarmError;
import dev.failsafe.Failsafe;
import dev.failsafe.FailsafeException;
import dev.failsafe.RetryPolicy;
import dev.failsafe.Timeout;
import dev.failsafe.TimeoutExceededException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls agents with a per attempt timeout and retries. Never throws: every problem is turned into a failed
 * {@link HopOutcome}.
 * <p>
 * Each attempt runs on the agent executor and the caller waits at most for the hop timeout. An agent that ignores
 * interrupts keeps its worker thread busy but cannot hold up the turn.
 */
@Slf4j
public class AgentInvoker {
    private static final Duration TIMEOUT_GRACE = Duration.ofMillis(100);

    private final Duration hopTimeout;
    private final HopRetrySetup retrySetup;
    private final ExecutorService executorService;

    public AgentInvoker(
            @NonNull Duration hopTimeout,
            @NonNull HopRetrySetup retrySetup,
            @NonNull ExecutorService executorService) {
        this.hopTimeout = hopTimeout;
        this.retrySetup = retrySetup;
        this.executorService = executorService;
    }

    public HopOutcome invoke(SwarmAgent agent, AgentInvocation invocation) {
        final var retryPolicy = RetryPolicy.<HopOutcome>builder()
                .withMaxAttempts(retrySetup.getTotalAttempts())
                .withBackoff(retrySetup.getInitialDelay(), retrySetup.getMaxDelay())
                .handleResultIf(outcome -> !outcome.isSuccess()
                        && retrySetup.getRetriableErrorTypes().contains(outcome.getError().getErrorType()))
                .onRetry(event -> log.warn("Retrying agent {} in conversation {}. Attempt: {}",
                                           agent.id(), invocation.getConversationId(), event.getAttemptCount() + 1))
                .build();
        return Failsafe.with(retryPolicy)
                .get(context -> attempt(agent, invocation, context.getAttemptCount() + 1));
    }

    private HopOutcome attempt(SwarmAgent agent, AgentInvocation invocation, int attempt) {
        log.debug("Calling agent {} for envelope {}. Attempt: {}",
                  agent.id(), invocation.getEnvelope().getSequenceNo(), attempt);
        final var timeout = Timeout.<AgentReply>builder(hopTimeout)
                .withInterrupt()
                .build();
        final var future = Failsafe.with(timeout)
                .with(executorService)
                .getAsync(() -> agent.respond(invocation));
        try {
            final var reply = future.get(hopTimeout.plus(TIMEOUT_GRACE).toMillis(), TimeUnit.MILLISECONDS);
            if (null == reply) {
                return HopOutcome.failure(SwarmError.error(ErrorType.AGENT_FAILURE, agent.id(), "no reply"), attempt);
            }
            return HopOutcome.success(reply, attempt);
        }
        catch (TimeoutException e) {
            //Worker did not give up on interrupt, leave it behind
            future.cancel(true);
            return timedOut(agent, attempt);
        }
        catch (ExecutionException e) {
            final var cause = null != e.getCause() ? e.getCause() : e;
            if (cause instanceof TimeoutExceededException) {
                return timedOut(agent, attempt);
            }
            final var error = cause instanceof FailsafeException && null != cause.getCause()
                              ? cause.getCause()
                              : cause;
            log.warn("Agent {} failed: {}", agent.id(), error.getMessage());
            return HopOutcome.failure(SwarmError.error(ErrorType.AGENT_FAILURE, agent.id(), error), attempt);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Interrupted while waiting for agent {}", agent.id());
            return HopOutcome.failure(SwarmError.error(ErrorType.AGENT_FAILURE, agent.id(), "interrupted"), attempt);
        }
        catch (RuntimeException e) {
            future.cancel(true);
            log.warn("Agent {} failed: {}", agent.id(), e.getMessage());
            return HopOutcome.failure(SwarmError.error(ErrorType.AGENT_FAILURE, agent.id(), e), attempt);
        }
    }

    private HopOutcome timedOut(SwarmAgent agent, int attempt) {
        log.warn("Agent {} timed out after {}", agent.id(), hopTimeout);
        return HopOutcome.failure(SwarmError.error(ErrorType.AGENT_TIMEOUT, agent.id(), hopTimeout), attempt);
    }
}
