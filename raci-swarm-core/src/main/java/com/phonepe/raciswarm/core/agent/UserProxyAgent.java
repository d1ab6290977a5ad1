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

import com.google.common.base.Preconditions;
import com.phonepe.raciswarm.core.model.RaciRole;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Set;

/**
 * Initializer that stands in for the user inside the swarm. It does no work of its own and hands every user
 * request to the accountable agent of the swarm.
 */
@Slf4j
public class UserProxyAgent implements SwarmAgent {
    private final AgentProfile profile;

    public UserProxyAgent(String id) {
        this(AgentProfile.builder()
                     .id(id)
                     .role(RaciRole.RESPONSIBLE)
                     .description("Relays user requests to the swarm and answers back to the user")
                     .capabilities(Set.of())
                     .build());
    }

    public UserProxyAgent(AgentProfile profile) {
        Preconditions.checkArgument(Objects.requireNonNull(profile).getRole() == RaciRole.RESPONSIBLE,
                                    "User proxy %s must be RESPONSIBLE", profile.getId());
        this.profile = profile;
    }

    @Override
    public AgentProfile profile() {
        return profile;
    }

    @Override
    public AgentReply respond(AgentInvocation invocation) {
        log.debug("Relaying request in conversation {} to the accountable agent", invocation.getConversationId());
        return AgentReply.delegateToRole(RaciRole.ACCOUNTABLE, invocation.goal());
    }
}
