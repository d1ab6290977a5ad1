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

import com.phonepe.raciswarm.core.errors.SwarmError;
import lombok.Value;

import java.util.concurrent.CompletableFuture;

/**
 * Result of submitting a request. When accepted, the conversation id is available right away and the response
 * completes once the turn is over.
 */
@Value
public class Submission {
    String conversationId;
    SwarmError error;
    CompletableFuture<SwarmResponse> response;

    public static Submission accepted(String conversationId, CompletableFuture<SwarmResponse> response) {
        return new Submission(conversationId, SwarmError.success(), response);
    }

    public static Submission rejected(SwarmResponse response) {
        return new Submission(null, response.getError(), CompletableFuture.completedFuture(response));
    }

    public boolean isAccepted() {
        return error.isSuccess();
    }
}
