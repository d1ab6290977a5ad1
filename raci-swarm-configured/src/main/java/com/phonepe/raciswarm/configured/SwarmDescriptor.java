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
import java.util.Set;

/**
 * A swarm as declared in a swarm configuration file. Agents are referred to by identifier.
 */
@Value
@Builder
@Jacksonized
public class SwarmDescriptor {
    @JsonProperty("identifier")
    String identifier;

    @JsonProperty("swarm_type")
    String swarmType;

    @Singular
    @JsonProperty("capabilities")
    Set<String> capabilities;

    @Singular
    @JsonProperty("agents")
    List<String> agents;

    @JsonProperty("created_by")
    String createdBy;
}
