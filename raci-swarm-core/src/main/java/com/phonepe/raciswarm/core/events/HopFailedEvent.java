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

package com.phonepe.raciswarm.core.events;

import com.phonepe.raciswarm.core.errors.ErrorType;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * An agent could not produce a reply, even after retries
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class HopFailedEvent extends SwarmEvent {
    String agentId;
    ErrorType errorType;
    String message;
    int attempts;

    @Builder
    @Jacksonized
    public HopFailedEvent(
            @NonNull String conversationId,
            @NonNull String agentId,
            @NonNull ErrorType errorType,
            String message,
            int attempts) {
        super(SwarmEventType.HOP_FAILED, conversationId);
        this.agentId = agentId;
        this.errorType = errorType;
        this.message = message;
        this.attempts = attempts;
    }

    @Override
    public <T> T accept(SwarmEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
