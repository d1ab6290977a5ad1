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

package com.phonepe.raciswarm.core.routing;

import com.google.common.base.Strings;
import com.phonepe.raciswarm.core.agent.SwarmAgent;
import com.phonepe.raciswarm.core.agent.replies.Delegation;
import com.phonepe.raciswarm.core.errors.ErrorType;
import com.phonepe.raciswarm.core.errors.SwarmError;
import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Checks delegations against the RACI rules of who may hand work to whom
 */
@UtilityClass
public class RoleBoundaries {

    /**
     * Resolve the recipients of a delegation. Role addressed delegations go to every member holding the role, except
     * the delegator itself.
     */
    public static DelegationRoute route(ResolvedSwarm swarm, SwarmAgent delegator, Delegation delegation) {
        if (!Strings.isNullOrEmpty(delegation.getTargetAgentId())) {
            final var targetId = delegation.getTargetAgentId();
            final var target = swarm.member(targetId).orElse(null);
            if (null == target) {
                return DelegationRoute.rejected(
                        SwarmError.error(ErrorType.UNKNOWN_RECIPIENT, delegator.id(), targetId));
            }
            if (target == delegator || !delegator.role().canDelegateTo(target.role())) {
                return DelegationRoute.rejected(
                        SwarmError.error(ErrorType.ROLE_VIOLATION, delegator.id(), delegator.role(), targetId));
            }
            return DelegationRoute.to(List.of(target));
        }
        final var role = delegation.getTargetRole();
        if (null == role) {
            return DelegationRoute.rejected(
                    SwarmError.error(ErrorType.UNKNOWN_RECIPIENT, delegator.id(), "<none>"));
        }
        if (!delegator.role().canDelegateTo(role)) {
            return DelegationRoute.rejected(
                    SwarmError.error(ErrorType.ROLE_VIOLATION, delegator.id(), delegator.role(), role));
        }
        final var targets = swarm.membersWithRole(role)
                .stream()
                .filter(agent -> agent != delegator)
                .toList();
        if (targets.isEmpty()) {
            return DelegationRoute.rejected(
                    SwarmError.error(ErrorType.UNKNOWN_RECIPIENT, delegator.id(), "role:" + role.getCode()));
        }
        return DelegationRoute.to(targets);
    }
}
