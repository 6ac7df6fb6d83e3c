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

package org.fireflyframework.minutes.workflow;

import java.util.Objects;

/**
 * Failure of a workflow operation, carrying its {@link WorkflowErrorKind} and a human-readable detail.
 */
public class WorkflowException extends RuntimeException {

    private final WorkflowErrorKind kind;
    private final String detail;

    public WorkflowException(WorkflowErrorKind kind, String detail) {
        this(kind, detail, null);
    }

    public WorkflowException(WorkflowErrorKind kind, String detail, Throwable cause) {
        super(kind.code() + ": " + detail, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.detail = detail;
    }

    public WorkflowErrorKind getKind() {
        return kind;
    }

    public String getDetail() {
        return detail;
    }
}
