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

import com.google.common.base.Strings;
import com.phonepe.raciswarm.configured.factories.UserProxyAgentFactory;
import com.phonepe.raciswarm.core.agent.AgentProfile;
import com.phonepe.raciswarm.core.agent.SwarmAgent;
import com.phonepe.raciswarm.core.errors.ParameterValidationError;
import com.phonepe.raciswarm.core.model.RaciRole;
import com.phonepe.raciswarm.core.model.Swarm;
import com.phonepe.raciswarm.core.routing.SwarmRegistry;
import lombok.Builder;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a {@link SwarmConfiguration} into registered agents and swarms. The whole configuration is checked before
 * anything is built and every problem found is reported in one {@link SwarmConfigurationException}.
 */
@Slf4j
public class SwarmConfigurationLoader {
    private final Map<String, AgentFactory> factories = new HashMap<>();

    @Builder
    public SwarmConfigurationLoader(@Singular List<AgentFactory> factories) {
        register(new UserProxyAgentFactory());
        Objects.requireNonNullElse(factories, List.<AgentFactory>of()).forEach(this::register);
    }

    public LoadedSwarms load(Path path) {
        return load(SwarmConfigurationReader.fromYAML(path));
    }

    /**
     * Build agents and swarms into a new registry
     *
     * @throws SwarmConfigurationException listing every problem if the configuration is not usable
     */
    public LoadedSwarms load(SwarmConfiguration configuration) {
        return load(configuration, new SwarmRegistry());
    }

    public LoadedSwarms load(SwarmConfiguration configuration, SwarmRegistry registry) {
        final var problems = new ArrayList<>(validate(configuration));
        final var agents = problems.isEmpty() ? createAgents(configuration, problems) : Map.<String, SwarmAgent>of();
        if (!problems.isEmpty()) {
            log.error("Swarm configuration has {} problems: {}", problems.size(), problems);
            throw new SwarmConfigurationException(problems);
        }
        agents.values().forEach(registry::registerAgent);
        configuration.getSwarms()
                .forEach(descriptor -> registry.registerSwarm(Swarm.builder()
                                                                    .name(descriptor.getIdentifier())
                                                                    .swarmType(descriptor.getSwarmType())
                                                                    .capabilities(descriptor.getCapabilities())
                                                                    .memberIds(descriptor.getAgents())
                                                                    .createdBy(descriptor.getCreatedBy())
                                                                    .build()));
        final var settings = Objects.requireNonNullElse(configuration.getOrchestrator(), OrchestratorSettings.DEFAULT);
        log.info("Loaded {} agents and {} swarms", agents.size(), configuration.getSwarms().size());
        return new LoadedSwarms(registry, settings.toSetup());
    }

    /**
     * @return Every problem found, empty if the configuration can be loaded
     */
    public List<String> validate(SwarmConfiguration configuration) {
        final var problems = new ArrayList<String>();
        if (null != configuration.getOrchestrator()) {
            problems.addAll(configuration.getOrchestrator().validate());
        }
        final var roles = validateAgents(configuration.getAgents(), problems);
        validateSwarms(configuration.getSwarms(), roles, problems);
        return problems;
    }

    private Map<String, Optional<RaciRole>> validateAgents(List<AgentDescriptor> agents, List<String> problems) {
        final var roles = new HashMap<String, Optional<RaciRole>>();
        for (int i = 0; i < agents.size(); i++) {
            final var agent = agents.get(i);
            final var id = agent.getIdentifier();
            if (Strings.isNullOrEmpty(id) || id.isBlank()) {
                problems.add("agents[%d]: identifier is required".formatted(i));
                continue;
            }
            if (roles.containsKey(id)) {
                problems.add("agent %s is declared more than once".formatted(id));
                continue;
            }
            roles.put(id, parseRole(agent, problems));
            final var agentType = normalizeType(agent.getAgentType());
            if (agentType.isEmpty()) {
                problems.add("agent %s: agent_type is required".formatted(id));
            }
            else if (!factories.containsKey(agentType)) {
                problems.add("agent %s: no factory registered for agent type %s".formatted(id, agentType));
            }
        }
        return roles;
    }

    private static void validateSwarms(
            List<SwarmDescriptor> swarms,
            Map<String, Optional<RaciRole>> roles,
            List<String> problems) {
        final var names = new HashSet<String>();
        for (int i = 0; i < swarms.size(); i++) {
            final var swarm = swarms.get(i);
            final var name = swarm.getIdentifier();
            if (Strings.isNullOrEmpty(name) || name.isBlank()) {
                problems.add("swarms[%d]: identifier is required".formatted(i));
                continue;
            }
            if (!names.add(name)) {
                problems.add("swarm %s is declared more than once".formatted(name));
                continue;
            }
            if (swarm.getCapabilities().isEmpty()) {
                problems.add("swarm %s declares no capabilities".formatted(name));
            }
            final var members = new HashSet<String>();
            final var roleCounts = new LinkedHashMap<RaciRole, Integer>();
            for (final var member : swarm.getAgents()) {
                if (!members.add(member)) {
                    problems.add("swarm %s lists agent %s more than once".formatted(name, member));
                    continue;
                }
                final var role = roles.get(member);
                if (null == role) {
                    problems.add("swarm %s refers to unknown agent %s".formatted(name, member));
                    continue;
                }
                role.ifPresent(r -> roleCounts.merge(r, 1, Integer::sum));
            }
            exactlyOne(name, RaciRole.RESPONSIBLE, roleCounts, problems);
            exactlyOne(name, RaciRole.ACCOUNTABLE, roleCounts, problems);
        }
    }

    private Map<String, SwarmAgent> createAgents(SwarmConfiguration configuration, List<String> problems) {
        final var agents = new LinkedHashMap<String, SwarmAgent>();
        for (final var descriptor : configuration.getAgents()) {
            final var profile = AgentProfile.builder()
                    .id(descriptor.getIdentifier())
                    .role(RaciRole.fromValue(descriptor.getRaciRole()))
                    .capabilities(descriptor.getCapabilities())
                    .description(descriptor.getDescription())
                    .goals(descriptor.getGoals())
                    .build();
            final var agentType = normalizeType(descriptor.getAgentType());
            try {
                final var agent = factories.get(agentType).create(profile, descriptor);
                if (null == agent || !profile.getId().equals(agent.id())) {
                    problems.add("agent %s: factory for %s did not build an agent with that id"
                                         .formatted(profile.getId(), agentType));
                    continue;
                }
                agents.put(agent.id(), agent);
                log.debug("Created agent {} of type {} with role {}", agent.id(), agentType, agent.role());
            }
            catch (RuntimeException e) {
                problems.add("agent %s: factory for %s failed: %s".formatted(profile.getId(), agentType,
                                                                             e.getMessage()));
            }
        }
        return agents;
    }

    private void register(AgentFactory factory) {
        final var agentType = normalizeType(factory.agentType());
        if (agentType.isEmpty()) {
            throw new ParameterValidationError("Agent factory must declare an agent type");
        }
        factories.put(agentType, factory);
    }

    private static Optional<RaciRole> parseRole(AgentDescriptor agent, List<String> problems) {
        try {
            return Optional.of(RaciRole.fromValue(agent.getRaciRole()));
        }
        catch (ParameterValidationError e) {
            problems.add("agent %s: %s".formatted(agent.getIdentifier(), e.getMessage()));
            return Optional.empty();
        }
    }

    private static void exactlyOne(
            String swarm,
            RaciRole role,
            Map<RaciRole, Integer> roleCounts,
            List<String> problems) {
        final var count = roleCounts.getOrDefault(role, 0);
        if (count != 1) {
            problems.add("swarm %s must have exactly one %s agent, found %d".formatted(swarm, role, count));
        }
    }

    private static String normalizeType(String agentType) {
        return Strings.nullToEmpty(agentType).trim().toLowerCase(Locale.ROOT);
    }
}
