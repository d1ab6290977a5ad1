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

import com.phonepe.raciswarm.core.envelope.MessageEnvelope;
import com.phonepe.raciswarm.core.errors.SwarmError;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Final response for one user turn
 */
@Value
@Builder
@Jacksonized
public class SwarmResponse {
    /**
     * Null when the request was not supported
     */
    String conversationId;
    int turn;
    ResponseStatus status;
    /**
     * What the user gets to see
     */
    String content;
    /**
     * The envelope that handed control back to the user, if one was produced
     */
    MessageEnvelope terminalEnvelope;
    SwarmError error;

    public boolean isSuccessful() {
        return status == ResponseStatus.COMPLETED;
    }
}
