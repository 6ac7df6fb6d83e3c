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

package org.fireflyframework.minutes.annotations;

import org.fireflyframework.minutes.config.MinutesWorkflowConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enables the minutes workflow components in a Spring application.
 * <p>
 * This annotation imports {@link MinutesWorkflowConfiguration} directly so it works
 * in both Spring Boot (auto-configuration) and plain Spring contexts
 * (e.g. {@code AnnotationConfigApplicationContext}).
 * <p>
 * The Redis transition journal is registered via
 * {@code META-INF/spring/org.springframework.boot.autoconfigure.AutoConfiguration.imports}
 * and activated automatically in Spring Boot applications.
 * <p>
 * Components wired by this annotation:
 * - {@code MinutesWorkflow}: the transition coordinator
 * - {@code WorkflowCollections}: in-memory collections (override by declaring your own bean)
 * - {@code ModeratorRoleResolver}: deny-all default (override by declaring your own bean)
 * - {@code FinalizeMailer}: logging-only default (override by declaring your own bean)
 * - {@code WorkflowEvents}: composite of logging, metrics and application sinks
 * - {@code WorkflowJournal}: in-memory journal and its recovery service
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
@Import(MinutesWorkflowConfiguration.class)
public @interface EnableMinutesWorkflow {
}
