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

import lombok.Builder;
import lombok.NonNull;

import java.util.function.Function;

/**
 * Agent backed by a plain function. Handy for thin tool wrappers and for tests.
 */
public class SimpleSwarmAgent implements SwarmAgent {
    private final AgentProfile profile;
    private final Function<AgentInvocation, AgentReply> handler;

    @Builder
    public SimpleSwarmAgent(@NonNull AgentProfile profile, @NonNull Function<AgentInvocation, AgentReply> handler) {
        this.profile = profile;
        this.handler = handler;
    }

    @Override
    public AgentProfile profile() {
        return profile;
    }

    @Override
    public AgentReply respond(AgentInvocation invocation) {
        return handler.apply(invocation);
    }
}
