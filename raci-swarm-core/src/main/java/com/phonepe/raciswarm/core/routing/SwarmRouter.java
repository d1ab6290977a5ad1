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

import com.phonepe.raciswarm.core.errors.ErrorType;
import com.phonepe.raciswarm.core.errors.SwarmException;
import com.phonepe.raciswarm.core.model.CapabilityTags;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Picks the swarm that handles a request, by capability tag. When more than one swarm claims a tag, the one registered
 * first wins.
 */
@Slf4j
public class SwarmRouter {
    @Getter
    private final SwarmRegistry registry;

    public SwarmRouter(SwarmRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param capabilityTag Capability requested. Case, surrounding blanks and space/underscore separators are ignored.
     * @return The matching swarm with its members looked up
     * @throws SwarmException with {@link ErrorType#NO_MATCHING_SWARM} if no registered swarm claims the capability
     */
    public ResolvedSwarm resolve(String capabilityTag) {
        return find(capabilityTag)
                .orElseThrow(() -> new SwarmException(ErrorType.NO_MATCHING_SWARM, capabilityTag));
    }

    public Optional<ResolvedSwarm> find(String capabilityTag) {
        final var tag = CapabilityTags.normalize(capabilityTag);
        if (tag.isEmpty()) {
            return Optional.empty();
        }
        final var resolved = registry.findFirst(swarm -> swarm.getCapabilities().contains(tag));
        if (resolved.isEmpty()) {
            log.debug("No swarm registered for capability {}", tag);
        }
        return resolved;
    }
}
