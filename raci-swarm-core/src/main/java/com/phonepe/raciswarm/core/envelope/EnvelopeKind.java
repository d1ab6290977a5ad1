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

package com.phonepe.raciswarm.core.envelope;

/**
 * What an envelope carries
 */
public enum EnvelopeKind {
    /**
     * Text typed by the user. Starts a turn.
     */
    USER_REQUEST,
    /**
     * An agent handing a narrowed sub goal to another agent
     */
    DELEGATION,
    /**
     * An agent answering the envelope it was given
     */
    ANSWER,
    /**
     * An agent hop that failed (timeout, crash, role violation). Routed like an answer.
     */
    FAILURE,
    /**
     * Generated by the orchestrator when a turn cannot complete normally
     */
    FALLBACK,
    ;

    public boolean isDelegation() {
        return this == DELEGATION;
    }
}
