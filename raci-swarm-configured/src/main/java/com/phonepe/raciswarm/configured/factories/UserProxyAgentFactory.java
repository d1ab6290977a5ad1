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
import com.phonepe.raciswarm.core.agent.AgentProfile;
import com.phonepe.raciswarm.core.agent.SwarmAgent;
import com.phonepe.raciswarm.core.agent.UserProxyAgent;

/**
 * Built in {@code user_proxy} agent type
 */
public class UserProxyAgentFactory implements AgentFactory {
    public static final String AGENT_TYPE = "user_proxy";

    @Override
    public String agentType() {
        return AGENT_TYPE;
    }

    @Override
    public SwarmAgent create(AgentProfile profile, AgentDescriptor descriptor) {
        return new UserProxyAgent(profile);
    }
}
