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

import lombok.Value;

/**
 * Error from a swarm run
 */
@Value
public class SwarmError {
    ErrorType errorType;
    String message;

    public static SwarmError success() {
        return new SwarmError(ErrorType.SUCCESS, ErrorType.SUCCESS.getMessage());
    }

    public static SwarmError error(ErrorType errorType, Object... args) {
        return new SwarmError(errorType, String.format(errorType.getMessage(), args));
    }

    public static SwarmError error(ErrorType errorType, String agentId, Throwable throwable) {
        var cause = throwable.getCause();
        var message = throwable.getMessage();
        while (cause != null) {
            message = cause.getMessage();
            cause = cause.getCause();
        }
        return SwarmError.error(errorType, agentId, message);
    }

    public boolean isSuccess() {
        return errorType == ErrorType.SUCCESS;
    }
}
