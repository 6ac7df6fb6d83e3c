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

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CallbackDocumentCollectionTest {

    /**
     * Store completing every call from a fresh thread, backed by an in-memory collection.
     */
    static class ThreadedStore implements CallbackDocumentStore {
        final InMemoryDocumentCollection backing = new InMemoryDocumentCollection("minutes");
        RuntimeException failure;

        @Override
        public String name() {
            return backing.name();
        }

        @Override
        public void insert(Map<String, Object> document, CompletionCallback<String> callback) {
            later(() -> backing.insert(document).block(), callback);
        }

        @Override
        public void update(DocumentSelector selector, DocumentUpdate update, CompletionCallback<Long> callback) {
            later(() -> backing.update(selector, update).block(), callback);
        }

        @Override
        public void remove(DocumentSelector selector, CompletionCallback<Long> callback) {
            later(() -> backing.remove(selector).block(), callback);
        }

        @Override
        public void find(DocumentSelector selector, CompletionCallback<List<Map<String, Object>>> callback) {
            later(() -> backing.find(selector).collectList().block(), callback);
        }

        private <T> void later(java.util.function.Supplier<T> call, CompletionCallback<T> callback) {
            new Thread(() -> {
                if (failure != null) {
                    callback.onComplete(failure, null);
                } else {
                    callback.onComplete(null, call.get());
                }
            }).start();
        }
    }

    @Test
    void bridgesCallbacksIntoMonos() {
        ThreadedStore store = new ThreadedStore();
        CallbackDocumentCollection collection = new CallbackDocumentCollection(store);

        StepVerifier.create(collection.insert(Map.of(Documents.ID, "m1", "meetingSeries_id", "ms-1")))
                .expectNext("m1")
                .verifyComplete();
        StepVerifier.create(collection.update(DocumentSelector.byId("m1"), DocumentUpdate.set("isFinalized", true)))
                .expectNext(1L)
                .verifyComplete();
        StepVerifier.create(collection.find(DocumentSelector.where("meetingSeries_id", "ms-1")))
                .assertNext(doc -> assertThat(doc).containsEntry("isFinalized", true))
                .verifyComplete();
        StepVerifier.create(collection.findOne(DocumentSelector.byId("other")))
                .verifyComplete();
        StepVerifier.create(collection.remove(DocumentSelector.byId("m1")))
                .expectNext(1L)
                .verifyComplete();

        assertThat(collection.executionMode()).isEqualTo(ExecutionMode.DEFERRED);
    }

    @Test
    void callbackErrorBecomesErrorSignal() {
        ThreadedStore store = new ThreadedStore();
        store.failure = new IllegalStateException("store offline");
        CallbackDocumentCollection collection = new CallbackDocumentCollection(store);

        StepVerifier.create(collection.insert(Map.of(Documents.ID, "m1")))
                .expectErrorMessage("store offline")
                .verify();
    }
}
