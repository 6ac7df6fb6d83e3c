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

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Single call contract for a document collection, independent of how the backing store completes its calls.
 * <p>
 * Every mutation is exposed twice:
 * <ul>
 *   <li>as a cold {@link Mono} that performs the call on subscription, so callers can chain continuations
 *       (including compensating actions) on the result regardless of execution context;</li>
 *   <li>as a fire-and-forget overload taking an optional {@link CompletionCallback}, invoked with
 *       {@code (error, result)} once the call completes.</li>
 * </ul>
 * <p>
 * Whether completion happens on the subscribing thread or later on another thread is reported by
 * {@link #executionMode()}; callers must not rely on either.
 * <p>
 * Thread-safety: implementations must be safe for concurrent use.
 */
public interface DocumentCollection {

    /**
     * @return logical collection name, used in logs
     */
    String name();

    ExecutionMode executionMode();

    /**
     * Inserts a document. A missing {@code _id} is generated.
     *
     * @return Mono emitting the id of the inserted document
     */
    Mono<String> insert(Map<String, Object> document);

    /**
     * Applies {@code update} to every document matching {@code selector}.
     *
     * @return Mono emitting the number of affected documents
     */
    Mono<Long> update(DocumentSelector selector, DocumentUpdate update);

    /**
     * Removes every document matching {@code selector}.
     *
     * @return Mono emitting the number of removed documents
     */
    Mono<Long> remove(DocumentSelector selector);

    /**
     * @return Mono emitting a copy of the first matching document, or empty
     */
    Mono<Map<String, Object>> findOne(DocumentSelector selector);

    /**
     * @return Flux of copies of all matching documents
     */
    Flux<Map<String, Object>> find(DocumentSelector selector);

    default Disposable insert(Map<String, Object> document, CompletionCallback<String> callback) {
        return subscribe(insert(document), callback);
    }

    default Disposable update(DocumentSelector selector, DocumentUpdate update, CompletionCallback<Long> callback) {
        return subscribe(update(selector, update), callback);
    }

    default Disposable remove(DocumentSelector selector, CompletionCallback<Long> callback) {
        return subscribe(remove(selector), callback);
    }

    private static <T> Disposable subscribe(Mono<T> call, CompletionCallback<T> callback) {
        if (callback == null) {
            // errors reach Reactor's dropped-error hook
            return call.subscribe();
        }
        return call.subscribe(
                result -> callback.onComplete(null, result),
                error -> callback.onComplete(error, null));
    }
}
