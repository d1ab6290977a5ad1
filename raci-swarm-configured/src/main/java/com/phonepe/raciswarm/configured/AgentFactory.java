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

import com.phonepe.raciswarm.core.agent.AgentProfile;
import com.phonepe.raciswarm.core.agent.SwarmAgent;

/**
 * Builds agents of one agent type. Implementations are supplied by the application embedding the swarms, since only
 * it knows how its agents do their work.
 */
public interface AgentFactory {
    /**
     * Value of {@code agent_type} this factory handles
     */
    String agentType();

    /**
     * @param profile    Profile built from the descriptor, role already parsed
     * @param descriptor The descriptor as written in configuration, for factory specific settings
     * @return The agent. Must use the given profile.
     */
    SwarmAgent create(AgentProfile profile, AgentDescriptor descriptor);
}
