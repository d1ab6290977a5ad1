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
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An agent as declared in a swarm configuration file
 */
@Value
@Builder
@Jacksonized
public class AgentDescriptor {
    @JsonProperty("identifier")
    String identifier;

    /**
     * One letter code (r, a, c, i) or full role name. Kept as text so that every bad value can be reported.
     */
    @JsonProperty("raci_role")
    String raciRole;

    /**
     * Selects the {@link AgentFactory} that builds the agent
     */
    @JsonProperty("agent_type")
    String agentType;

    @JsonProperty("agent_description")
    String description;

    @JsonProperty("goals")
    String goals;

    @Singular
    @JsonProperty("capabilities")
    Set<String> capabilities;

    /**
     * Tool ids made available to the agent by its factory
     */
    @Singular
    @JsonProperty("tools")
    List<String> tools;

    /**
     * Free form settings handed to the factory
     */
    @Singular
    @JsonProperty("properties")
    Map<String, Object> properties;
}
