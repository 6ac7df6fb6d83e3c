/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.minutes.security;

import org.fireflyframework.minutes.workflow.WorkflowErrorKind;
import org.fireflyframework.minutes.workflow.WorkflowException;

import java.util.Objects;

/**
 * Checks that a caller is authenticated and moderates the meeting series a transition touches.
 */
public class AuthorizationGate {

    private final ModeratorRoleResolver roleResolver;

    public AuthorizationGate(ModeratorRoleResolver roleResolver) {
        this.roleResolver = Objects.requireNonNull(roleResolver, "roleResolver");
    }

    /**
     * @throws WorkflowException with {@link WorkflowErrorKind#NOT_AUTHENTICATED} if no identity is established
     */
    public void requireAuthenticated(CallerIdentity caller) {
        if (caller == null || !caller.isAuthenticated()) {
            throw new WorkflowException(WorkflowErrorKind.NOT_AUTHENTICATED, "Caller is not authenticated");
        }
    }

    /**
     * @throws WorkflowException with {@link WorkflowErrorKind#NOT_AUTHENTICATED} or
     *                           {@link WorkflowErrorKind#NOT_AUTHORIZED}
     */
    public void authorize(CallerIdentity caller, String meetingSeriesId) {
        requireAuthenticated(caller);
        if (meetingSeriesId == null || !roleResolver.isModeratorOf(caller, meetingSeriesId)) {
            throw new WorkflowException(WorkflowErrorKind.NOT_AUTHORIZED,
                    "Cannot modify meeting series " + meetingSeriesId + ". You are not a moderator.");
        }
    }
}
