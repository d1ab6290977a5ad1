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

import com.phonepe.raciswarm.core.orchestrator.Orchestrator;
import com.phonepe.raciswarm.core.orchestrator.OrchestratorSetup;
import com.phonepe.raciswarm.core.routing.SwarmRegistry;
import com.phonepe.raciswarm.core.routing.SwarmRouter;
import lombok.Value;

/**
 * Result of loading a swarm configuration
 */
@Value
public class LoadedSwarms {
    SwarmRegistry registry;
    OrchestratorSetup setup;

    public SwarmRouter router() {
        return new SwarmRouter(registry);
    }

    /**
     * Orchestrator builder with router and setup filled in. Store, archive and event bus can still be set.
     */
    public Orchestrator.OrchestratorBuilder orchestrator() {
        return Orchestrator.builder()
                .router(router())
                .setup(setup);
    }
}
