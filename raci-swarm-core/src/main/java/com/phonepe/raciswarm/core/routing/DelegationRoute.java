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

import com.phonepe.raciswarm.core.agent.SwarmAgent;
import com.phonepe.raciswarm.core.errors.SwarmError;

import java.util.List;

/**
 * Where a delegation goes: either a list of agents or the reason it cannot go anywhere
 */
public record DelegationRoute(List<SwarmAgent> targets, SwarmError error) {
    public static DelegationRoute to(List<SwarmAgent> targets) {
        return new DelegationRoute(List.copyOf(targets), null);
    }

    public static DelegationRoute rejected(SwarmError error) {
        return new DelegationRoute(List.of(), error);
    }

    public boolean isRejected() {
        return error != null;
    }
}
