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

package com.phonepe.raciswarm.core.routing;

import com.phonepe.raciswarm.core.agent.AgentProfile;
import com.phonepe.raciswarm.core.agent.SwarmAgent;
import com.phonepe.raciswarm.core.model.RaciRole;
import com.phonepe.raciswarm.core.model.Swarm;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A swarm with its member agents looked up. Members are the registered agent instances, never copies.
 */
public class ResolvedSwarm {
    @Getter
    private final Swarm swarm;
    private final Map<String, SwarmAgent> members;
    @Getter
    private final SwarmAgent initializer;
    @Getter
    private final SwarmAgent admin;

    ResolvedSwarm(Swarm swarm, List<SwarmAgent> members) {
        this.swarm = swarm;
        this.members = new LinkedHashMap<>();
        members.forEach(agent -> this.members.put(agent.id(), agent));
        this.initializer = single(members, RaciRole.RESPONSIBLE);
        this.admin = single(members, RaciRole.ACCOUNTABLE);
    }

    public String getName() {
        return swarm.getName();
    }

    public Optional<SwarmAgent> member(String agentId) {
        return Optional.ofNullable(members.get(agentId));
    }

    public List<SwarmAgent> members() {
        return List.copyOf(members.values());
    }

    public List<SwarmAgent> membersWithRole(RaciRole role) {
        return members.values()
                .stream()
                .filter(agent -> agent.role() == role)
                .toList();
    }

    public List<AgentProfile> roster() {
        return members.values()
                .stream()
                .map(SwarmAgent::profile)
                .toList();
    }

    public Map<String, RaciRole> roles() {
        final var roles = new LinkedHashMap<String, RaciRole>();
        members.values().forEach(agent -> roles.put(agent.id(), agent.role()));
        return roles;
    }

    private static SwarmAgent single(List<SwarmAgent> members, RaciRole role) {
        return members.stream()
                .filter(agent -> agent.role() == role)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Swarm has no agent with role " + role));
    }
}
