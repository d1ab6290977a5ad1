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

import com.google.common.base.Strings;
import com.phonepe.raciswarm.core.agent.SwarmAgent;
import com.phonepe.raciswarm.core.errors.ErrorType;
import com.phonepe.raciswarm.core.errors.ParameterValidationError;
import com.phonepe.raciswarm.core.errors.SwarmException;
import com.phonepe.raciswarm.core.model.RaciRole;
import com.phonepe.raciswarm.core.model.Swarm;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Registered agents and swarms. Read mostly: lookups share a read lock, registration takes the write lock.
 */
@Slf4j
public class SwarmRegistry {
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, SwarmAgent> agents = new LinkedHashMap<>();
    private final Map<String, Swarm> swarms = new LinkedHashMap<>();

    /**
     * Register an agent so that swarms can refer to it. Registering the same instance again is a no-op.
     *
     * @throws ParameterValidationError if a different agent with the same id is already registered
     */
    public SwarmRegistry registerAgent(SwarmAgent agent) {
        return write(() -> {
            final var existing = agents.get(agent.id());
            if (existing != null && existing != agent) {
                throw new ParameterValidationError("An agent with id %s is already registered".formatted(agent.id()));
            }
            agents.put(agent.id(), agent);
            log.debug("Registered agent {} with role {}", agent.id(), agent.role());
            return this;
        });
    }

    /**
     * Register a swarm. All members must already be registered.
     *
     * @throws SwarmException with {@link ErrorType#INVALID_SWARM} if the swarm does not have exactly one Responsible
     *                        and one Accountable member, has unknown or duplicate members or reuses a name
     */
    public SwarmRegistry registerSwarm(Swarm swarm) {
        return write(() -> {
            if (swarms.containsKey(swarm.getName())) {
                throw invalid(swarm, "a swarm with this name is already registered");
            }
            resolveMembers(swarm);
            swarms.put(swarm.getName(), swarm);
            log.info("Registered swarm {} with members {} for capabilities {}",
                     swarm.getName(), swarm.getMemberIds(), swarm.getCapabilities());
            return this;
        });
    }

    public boolean unregisterSwarm(String name) {
        return write(() -> {
            final var removed = swarms.remove(name) != null;
            if (removed) {
                log.info("Unregistered swarm {}", name);
            }
            return removed;
        });
    }

    public Optional<SwarmAgent> agent(String agentId) {
        return read(() -> Optional.ofNullable(agents.get(agentId)));
    }

    public Optional<Swarm> swarm(String name) {
        return read(() -> Optional.ofNullable(swarms.get(name)));
    }

    /**
     * @return Registered swarms, in registration order
     */
    public List<Swarm> swarms() {
        return read(() -> List.copyOf(swarms.values()));
    }

    public List<SwarmAgent> agents() {
        return read(() -> List.copyOf(agents.values()));
    }

    /**
     * Find the first registered swarm matching the predicate and look up its members
     */
    Optional<ResolvedSwarm> findFirst(Predicate<Swarm> matcher) {
        return read(() -> swarms.values()
                .stream()
                .filter(matcher)
                .findFirst()
                .map(swarm -> new ResolvedSwarm(swarm, resolveMembers(swarm))));
    }

    private List<SwarmAgent> resolveMembers(Swarm swarm) {
        if (Strings.isNullOrEmpty(swarm.getName())) {
            throw invalid(swarm, "name is required");
        }
        final var seen = new HashSet<String>();
        final var members = new ArrayList<SwarmAgent>();
        for (final var memberId : swarm.getMemberIds()) {
            if (!seen.add(memberId)) {
                throw invalid(swarm, "agent %s is listed more than once".formatted(memberId));
            }
            final var agent = agents.get(memberId);
            if (null == agent) {
                throw invalid(swarm, "agent %s is not registered".formatted(memberId));
            }
            members.add(agent);
        }
        checkSingle(swarm, members, RaciRole.RESPONSIBLE);
        checkSingle(swarm, members, RaciRole.ACCOUNTABLE);
        return members;
    }

    private static void checkSingle(Swarm swarm, List<SwarmAgent> members, RaciRole role) {
        final var count = members.stream().filter(agent -> agent.role() == role).count();
        if (count != 1) {
            throw invalid(swarm, "needs exactly one %s agent, found %d".formatted(role, count));
        }
    }

    private static SwarmException invalid(Swarm swarm, String reason) {
        return new SwarmException(ErrorType.INVALID_SWARM, swarm.getName(), reason);
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        }
        finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        }
        finally {
            lock.writeLock().unlock();
        }
    }
}
