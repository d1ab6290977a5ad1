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

package com.phonepe.raciswarm.configured.factories;

import com.phonepe.raciswarm.configured.AgentDescriptor;
import com.phonepe.raciswarm.configured.AgentFactory;
import com.phonepe.raciswarm.core.agent.AgentInvocation;
import com.phonepe.raciswarm.core.agent.AgentProfile;
import com.phonepe.raciswarm.core.agent.AgentReply;
import com.phonepe.raciswarm.core.agent.SimpleSwarmAgent;
import com.phonepe.raciswarm.core.agent.SwarmAgent;
import lombok.NonNull;

import java.util.function.BiFunction;

/**
 * Factory for agent types whose behaviour is a plain function. Lets an application register an agent type without
 * writing a factory class.
 */
public class FunctionAgentFactory implements AgentFactory {
    private final String agentType;
    private final BiFunction<AgentDescriptor, AgentInvocation, AgentReply> handler;

    public FunctionAgentFactory(
            @NonNull String agentType,
            @NonNull BiFunction<AgentDescriptor, AgentInvocation, AgentReply> handler) {
        this.agentType = agentType;
        this.handler = handler;
    }

    @Override
    public String agentType() {
        return agentType;
    }

    @Override
    public SwarmAgent create(AgentProfile profile, AgentDescriptor descriptor) {
        return SimpleSwarmAgent.builder()
                .profile(profile)
                .handler(invocation -> handler.apply(descriptor, invocation))
                .build();
    }
}
