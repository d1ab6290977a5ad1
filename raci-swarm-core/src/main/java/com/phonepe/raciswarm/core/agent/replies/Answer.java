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
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Objects;

/**
 * The agent is done with its part. The answer goes back to whoever asked.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Answer extends AgentReply {
    String content;

    @Builder
    @Jacksonized
    public Answer(String content) {
        super(AgentReplyType.ANSWER);
        this.content = Objects.requireNonNullElse(content, "");
    }

    @Override
    public <T> T accept(AgentReplyVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
