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

package com.phonepe.raciswarm.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Everything that can go wrong while a swarm works on a request
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    SUCCESS("Success", false),
    NO_MATCHING_SWARM("No registered swarm supports capability: %s", false),
    AGENT_TIMEOUT("Agent %s did not respond within %s", true),
    AGENT_FAILURE("Agent %s failed. Error: %s", false),
    DELEGATION_DEPTH_EXCEEDED("Delegation hop ceiling of %d reached", false),
    MEMORY_BUDGET_EXCEEDED("Memory budget of %d exceeded for conversation %s", false),
    ROLE_VIOLATION("Agent %s with role %s may not delegate to %s", false),
    UNKNOWN_RECIPIENT("Agent %s tried to reach unknown recipient: %s", false),
    CONVERSATION_NOT_FOUND("No conversation found with id: %s", false),
    CONVERSATION_CLOSED("Conversation %s is closed", false),
    INVALID_STATE_TRANSITION("Conversation %s cannot move from %s to %s", false),
    CONVERSATION_TIMEOUT("Conversation %s did not complete within %s", false),
    INVALID_SWARM("Invalid swarm %s: %s", false),
    INVALID_CONFIGURATION("Invalid swarm configuration: %s", false),
    INTERNAL_ERROR("Internal error: %s", false),
    ;

    private final String message;
    private final boolean retryable;
}
