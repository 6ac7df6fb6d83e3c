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

package org.fireflyframework.minutes.collection;

/**
 * Completion signal for callback-completed collection calls.
 * Exactly one of {@code error} and {@code result} is meaningful: a non-null error means the call failed.
 *
 * @param <T> result type (new document id or affected document count)
 */
@FunctionalInterface
public interface CompletionCallback<T> {

    void onComplete(Throwable error, T result);
}
