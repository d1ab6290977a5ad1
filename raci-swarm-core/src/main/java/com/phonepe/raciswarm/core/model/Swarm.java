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

package com.phonepe.raciswarm.core.model;

import com.phonepe.raciswarm.core.utils.SwarmUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named set of agents that handles a class of requests. A swarm only holds the ids of its members.
 * The agents themselves live in the {@link com.phonepe.raciswarm.core.routing.SwarmRegistry} and can be shared
 * between any number of swarms.
 */
@Value
@With
public class Swarm {
    String name;
    String swarmType;
    /**
     * Normalized capability tags this swarm claims
     */
    Set<String> capabilities;
    /**
     * Ids of member agents, in declaration order
     */
    List<String> memberIds;
    String createdBy;
    long createdAt;

    @Builder
    @Jacksonized
    public Swarm(
            @NonNull String name,
            String swarmType,
            Set<String> capabilities,
            @NonNull List<String> memberIds,
            String createdBy,
            long createdAt) {
        this.name = name;
        this.swarmType = Objects.requireNonNullElse(swarmType, name);
        this.capabilities = CapabilityTags.normalize(capabilities);
        this.memberIds = List.copyOf(memberIds);
        this.createdBy = createdBy;
        this.createdAt = createdAt > 0 ? createdAt : SwarmUtils.epochMicro();
    }

    public boolean supports(String capability) {
        return capabilities.contains(CapabilityTags.normalize(capability));
    }
}
