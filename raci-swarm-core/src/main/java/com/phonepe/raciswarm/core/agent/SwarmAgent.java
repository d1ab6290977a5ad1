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

package com.phonepe.raciswarm.core.agent;

import com.phonepe.raciswarm.core.model.RaciRole;

/**
 * A participant in a swarm. Implementations wrap whatever does the actual work (a model call, a tool service etc.).
 * <p>
 * Agents never touch conversation state. They look at the {@link AgentInvocation} they are given and return either
 * an answer or a delegation; the orchestrator turns that into an envelope. Calls to external services are the
 * agent's own business. Exceptions thrown from {@link #respond(AgentInvocation)} are turned into failure envelopes
 * and do not stop the conversation.
 * <p>
 * Implementations must be safe for concurrent use, as the same agent instance is shared by all swarms it is part of
 * and by all conversations running on those swarms.
 */
public interface SwarmAgent {
    AgentProfile profile();

    AgentReply respond(AgentInvocation invocation);

    default String id() {
        return profile().getId();
    }

    default RaciRole role() {
        return profile().getRole();
    }
}
