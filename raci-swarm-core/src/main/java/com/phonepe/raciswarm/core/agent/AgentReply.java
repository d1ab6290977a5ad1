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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.phonepe.raciswarm.core.agent.replies.Answer;
import com.phonepe.raciswarm.core.agent.replies.Delegation;
import com.phonepe.raciswarm.core.model.RaciRole;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * What an agent returns for a hop: a final answer for its part of the work or a delegation to another agent
 */
@Data
@AllArgsConstructor(access = AccessLevel.PROTECTED)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(name = "ANSWER", value = Answer.class),
        @JsonSubTypes.Type(name = "DELEGATION", value = Delegation.class),
})
public abstract class AgentReply {
    private final AgentReplyType type;

    public abstract <T> T accept(AgentReplyVisitor<T> visitor);

    public static AgentReply answer(String content) {
        return new Answer(content);
    }

    public static AgentReply delegateTo(String agentId, String subGoal) {
        return Delegation.builder()
                .targetAgentId(agentId)
                .subGoal(subGoal)
                .build();
    }

    public static AgentReply delegateToRole(RaciRole role, String subGoal) {
        return Delegation.builder()
                .targetRole(role)
                .subGoal(subGoal)
                .build();
    }
}
