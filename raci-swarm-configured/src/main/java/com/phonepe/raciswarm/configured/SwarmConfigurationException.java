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

package com.phonepe.raciswarm.configured;

import com.phonepe.raciswarm.core.errors.ErrorType;
import com.phonepe.raciswarm.core.errors.SwarmException;
import lombok.Getter;

import java.util.List;

/**
 * Raised when a swarm configuration cannot be used. Lists every problem found, not just the first one.
 */
@Getter
public class SwarmConfigurationException extends SwarmException {
    private final List<String> problems;

    public SwarmConfigurationException(List<String> problems) {
        super(ErrorType.INVALID_CONFIGURATION, String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }
}
