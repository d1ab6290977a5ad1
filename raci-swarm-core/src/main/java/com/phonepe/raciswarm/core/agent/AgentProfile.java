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

package com.phonepe.raciswarm.core.agent;

import com.phonepe.raciswarm.core.model.CapabilityTags;
import com.phonepe.raciswarm.core.model.RaciRole;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Set;

/**
 * Identity of an agent: who it is, what RACI role it plays and what it can do
 */
@Value
public class AgentProfile {
    String id;
    RaciRole role;
    Set<String> capabilities;
    String description;
    String goals;

    @Builder
    @Jacksonized
    public AgentProfile(
            @NonNull String id,
            @NonNull RaciRole role,
            Set<String> capabilities,
            String description,
            String goals) {
        this.id = id;
        this.role = role;
        this.capabilities = CapabilityTags.normalize(capabilities);
        this.description = description;
        this.goals = goals;
    }
}
