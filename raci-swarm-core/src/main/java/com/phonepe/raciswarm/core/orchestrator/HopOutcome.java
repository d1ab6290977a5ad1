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

import com.phonepe.raciswarm.core.agent.AgentReply;
import com.phonepe.raciswarm.core.errors.SwarmError;
import lombok.Value;

/**
 * What came out of calling an agent for one hop, retries included
 */
@Value
public class HopOutcome {
    AgentReply reply;
    SwarmError error;
    int attempts;

    public static HopOutcome success(AgentReply reply, int attempts) {
        return new HopOutcome(reply, SwarmError.success(), attempts);
    }

    public static HopOutcome failure(SwarmError error, int attempts) {
        return new HopOutcome(null, error, attempts);
    }

    public boolean isSuccess() {
        return error.isSuccess();
    }
}
