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

package org.fireflyframework.minutes.persistence;

/**
 * Status of a journaled workflow transition.
 */
public enum TransitionStatus {

    /**
     * The transition passed authorization and its writes are in progress.
     */
    STARTED,

    /**
     * All writes of the transition succeeded.
     */
    COMPLETED,

    /**
     * The transition failed before anything needed undoing.
     */
    FAILED,

    /**
     * A later write failed and the earlier write was undone.
     */
    COMPENSATED,

    /**
     * A later write failed and undoing the earlier write failed too.
     * The two collections may disagree and need manual repair.
     */
    INCONSISTENT;

    public boolean isCompleted() {
        return this != STARTED;
    }

    public boolean isInFlight() {
        return this == STARTED;
    }

    public boolean requiresIntervention() {
        return this == INCONSISTENT;
    }
}
