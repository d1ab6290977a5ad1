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

package com.phonepe.raciswarm.core.agent.replies;

import com.phonepe.raciswarm.core.agent.AgentReply;
import com.phonepe.raciswarm.core.agent.AgentReplyType;
import com.phonepe.raciswarm.core.agent.AgentReplyVisitor;
import com.phonepe.raciswarm.core.model.RaciRole;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Objects;

/**
 * The agent hands a narrowed sub goal to another agent. Either a specific agent is addressed by id, or all members of
 * the swarm holding a role are addressed together. When both are set the agent id wins.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Delegation extends AgentReply {
    String targetAgentId;
    RaciRole targetRole;
    String subGoal;

    @Builder
    @Jacksonized
    public Delegation(String targetAgentId, RaciRole targetRole, String subGoal) {
        super(AgentReplyType.DELEGATION);
        this.targetAgentId = targetAgentId;
        this.targetRole = targetRole;
        this.subGoal = Objects.requireNonNullElse(subGoal, "");
    }

    public boolean isBroadcast() {
        return targetAgentId == null && targetRole != null;
    }

    @Override
    public <T> T accept(AgentReplyVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
