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

import java.util.List;
import java.util.Map;

/**
 * A store that reports completion only through callbacks, typically from its own I/O threads.
 * Adapt it to {@link DocumentCollection} with {@link CallbackDocumentCollection}.
 */
public interface CallbackDocumentStore {

    String name();

    void insert(Map<String, Object> document, CompletionCallback<String> callback);

    void update(DocumentSelector selector, DocumentUpdate update, CompletionCallback<Long> callback);

    void remove(DocumentSelector selector, CompletionCallback<Long> callback);

    void find(DocumentSelector selector, CompletionCallback<List<Map<String, Object>>> callback);
}
