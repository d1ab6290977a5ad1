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

package com.phonepe.raciswarm.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.google.common.base.Strings;
import com.phonepe.raciswarm.core.errors.ParameterValidationError;
import lombok.Getter;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * The role a participant plays in a swarm.
 * Each role knows which other roles it may hand work to.
 */
@Getter
public enum RaciRole {
    /**
     * Executes. Receives the user request (the initializer) and gets the final answer back.
     */
    RESPONSIBLE("r"),
    /**
     * Owns the outcome (the admin). Coordinates consulted and informed agents.
     */
    ACCOUNTABLE("a"),
    /**
     * Provides input when asked.
     */
    CONSULTED("c"),
    /**
     * Kept up to date.
     */
    INFORMED("i"),
    ;

    private final String code;

    RaciRole(String code) {
        this.code = code;
    }

    /**
     * @param target Role of the agent being delegated to
     * @return true if an agent in this role is allowed to delegate to an agent in the target role
     */
    public boolean canDelegateTo(RaciRole target) {
        return delegationTargets().contains(target);
    }

    public Set<RaciRole> delegationTargets() {
        return switch (this) {
            case RESPONSIBLE -> EnumSet.of(ACCOUNTABLE);
            case ACCOUNTABLE, CONSULTED -> EnumSet.of(CONSULTED, INFORMED);
            case INFORMED -> EnumSet.noneOf(RaciRole.class);
        };
    }

    /**
     * Parses either the one letter code (r, a, c, i) or the full role name. Case is ignored.
     */
    @JsonCreator
    public static RaciRole fromValue(String value) {
        if (Strings.isNullOrEmpty(value)) {
            throw new ParameterValidationError("RACI role cannot be empty");
        }
        final var normalized = value.trim();
        return Arrays.stream(values())
                .filter(role -> role.code.equalsIgnoreCase(normalized) || role.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new ParameterValidationError("Unknown RACI role: " + value));
    }
}
