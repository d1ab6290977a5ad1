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

package com.phonepe.raciswarm.core.conversation;

/**
 * Lifecycle of a conversation
 */
public enum ConversationState {
    /**
     * A user request came in and no agent has responded yet
     */
    OPEN,
    /**
     * Agents are exchanging envelopes
     */
    DELEGATING,
    /**
     * The terminal envelope has been delivered. Waiting for the user.
     */
    AWAITING_USER,
    /**
     * Ended explicitly or timed out. Never reopened.
     */
    CLOSED,
}
