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

import lombok.Getter;

/**
 * Raised when an operation cannot be completed. Carries the structured {@link SwarmError}.
 */
@Getter
public class SwarmException extends RuntimeException {
    private final transient SwarmError error;

    public SwarmException(SwarmError error) {
        super(error.getMessage());
        this.error = error;
    }

    public SwarmException(ErrorType errorType, Object... args) {
        this(SwarmError.error(errorType, args));
    }

    public ErrorType getErrorType() {
        return error.getErrorType();
    }
}
