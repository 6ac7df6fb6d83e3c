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

package org.fireflyframework.minutes.domain;

import org.fireflyframework.minutes.collection.DocumentMapper;
import org.fireflyframework.minutes.collection.DocumentSelector;
import org.fireflyframework.minutes.collection.Documents;
import org.fireflyframework.minutes.collection.WorkflowCollections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Loads entities from the workflow collections. A meeting series is returned with its minutes
 * attached in the order of its {@code minutes} list, so that entity predicates are pure.
 */
public class WorkflowEntityLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEntityLoader.class);

    private final WorkflowCollections collections;
    private final DocumentMapper mapper;

    public WorkflowEntityLoader(WorkflowCollections collections, DocumentMapper mapper) {
        this.collections = Objects.requireNonNull(collections, "collections");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public Mono<Minutes> loadMinutes(String minutesId) {
        return collections.minutes().findOne(DocumentSelector.byId(minutesId))
                .map(doc -> mapper.fromDocument(doc, Minutes.class));
    }

    public Mono<MeetingSeries> loadMeetingSeries(String meetingSeriesId) {
        return collections.meetingSeries().findOne(DocumentSelector.byId(meetingSeriesId))
                .map(doc -> mapper.fromDocument(doc, MeetingSeries.class))
                .flatMap(this::attachMinutes);
    }

    private Mono<MeetingSeries> attachMinutes(MeetingSeries series) {
        return Flux.fromIterable(series.getMinutes())
                .flatMap(id -> collections.minutes().findOne(DocumentSelector.byId(id)))
                .collect(Collectors.toMap(Documents::idOf, Function.identity(), (a, b) -> a))
                .map(byId -> series.attachMinutes(ordered(series, byId)));
    }

    private List<Minutes> ordered(MeetingSeries series, Map<String, Map<String, Object>> byId) {
        List<Minutes> ordered = new ArrayList<>(series.getMinutes().size());
        for (String id : series.getMinutes()) {
            Map<String, Object> doc = byId.get(id);
            if (doc == null) {
                log.warn("Meeting series {} references missing minutes {}", series.getId(), id);
                continue;
            }
            ordered.add(mapper.fromDocument(doc, Minutes.class));
        }
        return ordered;
    }
}
