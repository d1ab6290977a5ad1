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

import com.phonepe.raciswarm.core.envelope.MessageEnvelope;
import com.phonepe.raciswarm.core.memory.ContextSlice;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Everything an agent gets to see for one hop
 */
@Value
@Builder
public class AgentInvocation {
    String conversationId;
    String userId;
    String swarmName;
    int turn;
    /**
     * The latest envelope addressed to the agent
     */
    MessageEnvelope envelope;
    /**
     * The part of the conversation memory the agent's role is allowed to see
     */
    ContextSlice context;
    /**
     * All members of the swarm, for picking delegation targets
     */
    List<AgentProfile> roster;

    public String goal() {
        return envelope.getContent();
    }

    public String requesterId() {
        return envelope.getSenderId();
    }

    public Optional<AgentProfile> member(String agentId) {
        return roster.stream()
                .filter(profile -> profile.getId().equals(agentId))
                .findFirst();
    }
}
