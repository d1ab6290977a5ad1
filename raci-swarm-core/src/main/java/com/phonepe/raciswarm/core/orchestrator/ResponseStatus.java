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

package com.phonepe.raciswarm.core.orchestrator;

/**
 * How a turn ended, from the user's point of view
 */
public enum ResponseStatus {
    /**
     * The swarm produced an answer
     */
    COMPLETED,
    /**
     * The hop ceiling was hit; the content summarizes partial progress
     */
    FALLBACK,
    /**
     * The turn could not complete; the content is a generic message
     */
    DEGRADED,
    /**
     * No swarm handles the requested capability. No conversation was created.
     */
    UNSUPPORTED,
    /**
     * The conversation was closed before the turn could complete
     */
    CLOSED,
}
