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

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A meeting series: the ordered list of its minutes ids plus the topic state synchronized from
 * the most recent finalize or unfinalize.
 * <p>
 * The predicates and topic merges operate on the minutes attached through
 * {@link #attachMinutes(List)}, ordered like {@link #getMinutes()}. They never touch storage.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MeetingSeries {

    public static final String FIELD_MINUTES = "minutes";
    public static final String FIELD_TOPICS = "topics";
    public static final String FIELD_OPEN_TOPICS = "openTopics";

    @JsonProperty("_id")
    private String id;
    private String name;
    private List<String> minutes = new ArrayList<>();
    private List<Topic> topics = new ArrayList<>();
    private List<Topic> openTopics = new ArrayList<>();

    @JsonIgnore
    private List<Minutes> loadedMinutes = new ArrayList<>();

    public MeetingSeries() {
    }

    public MeetingSeries(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public MeetingSeries attachMinutes(List<Minutes> orderedMinutes) {
        this.loadedMinutes = new ArrayList<>(orderedMinutes);
        return this;
    }

    public List<Minutes> attachedMinutes() {
        return Collections.unmodifiableList(loadedMinutes);
    }

    /**
     * @return the most recently added minutes, or {@code null} when the series has none
     */
    public Minutes lastMinutes() {
        return loadedMinutes.isEmpty() ? null : loadedMinutes.get(loadedMinutes.size() - 1);
    }

    /**
     * @return the most recently added minutes that is finalized, or {@code null}
     */
    public Minutes lastFinalizedMinutes() {
        for (int i = loadedMinutes.size() - 1; i >= 0; i--) {
            if (loadedMinutes.get(i).isFinalized()) {
                return loadedMinutes.get(i);
            }
        }
        return null;
    }

    public boolean addNewMinutesAllowed() {
        Minutes last = lastMinutes();
        return last == null || last.isFinalized();
    }

    /**
     * A date is allowed unless some other finalized minutes is dated on or after it.
     *
     * @param excludeMinutesId minutes to ignore (the one being edited), may be {@code null}
     */
    public boolean isMinutesDateAllowed(String excludeMinutesId, LocalDate date) {
        if (date == null) {
            return false;
        }
        for (Minutes m : loadedMinutes) {
            if (Objects.equals(m.getId(), excludeMinutesId) || !m.isFinalized() || m.getDate() == null) {
                continue;
            }
            if (!m.getDate().isBefore(date)) {
                return false;
            }
        }
        return true;
    }

    public boolean isUnfinalizeMinutesAllowed(String minutesId) {
        Minutes lastFinalized = lastFinalizedMinutes();
        return lastFinalized != null && Objects.equals(lastFinalized.getId(), minutesId);
    }

    public boolean isLastMinutes(String minutesId) {
        Minutes last = lastMinutes();
        return last != null && Objects.equals(last.getId(), minutesId);
    }

    /**
     * Merges the topics of the last minutes into the series topics and recomputes the open topics.
     *
     * @throws IllegalStateException if the series has no minutes
     */
    public void finalizeLastMinutes() {
        Minutes last = lastMinutes();
        if (last == null) {
            throw new IllegalStateException("Meeting series " + id + " has no minutes to finalize");
        }
        topics = merge(topics, last.getTopics());
        openTopics = openOf(topics);
    }

    /**
     * Reverts the merge of the last finalized minutes by replaying every earlier finalized minutes.
     *
     * @throws IllegalStateException if no minutes of the series is finalized
     */
    public void unfinalizeLastMinutes() {
        Minutes lastFinalized = lastFinalizedMinutes();
        if (lastFinalized == null) {
            throw new IllegalStateException("Meeting series " + id + " has no finalized minutes");
        }
        List<Topic> rebuilt = new ArrayList<>();
        for (Minutes m : loadedMinutes) {
            if (m == lastFinalized) {
                break;
            }
            if (m.isFinalized()) {
                rebuilt = merge(rebuilt, m.getTopics());
            }
        }
        topics = rebuilt;
        openTopics = openOf(rebuilt);
    }

    private static List<Topic> merge(List<Topic> seriesTopics, List<Topic> minutesTopics) {
        List<Topic> merged = new ArrayList<>(seriesTopics.size() + minutesTopics.size());
        Map<String, Integer> positions = new LinkedHashMap<>();
        for (Topic topic : seriesTopics) {
            if (topic.getId() != null) {
                positions.put(topic.getId(), merged.size());
            }
            merged.add(topic.copy());
        }
        List<Topic> prepended = new ArrayList<>();
        for (Topic topic : minutesTopics) {
            Integer position = topic.getId() != null ? positions.get(topic.getId()) : null;
            if (position != null) {
                merged.set(position, topic.copy());
            } else {
                prepended.add(topic.copy());
            }
        }
        merged.addAll(0, prepended);
        return merged;
    }

    private static List<Topic> openOf(List<Topic> topics) {
        List<Topic> open = new ArrayList<>();
        for (Topic topic : topics) {
            if (topic.isOpen()) {
                open.add(topic.copy());
            }
        }
        return open;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public List<String> getMinutes() { return minutes; }
    public void setMinutes(List<String> minutes) {
        this.minutes = minutes != null ? new ArrayList<>(minutes) : new ArrayList<>();
    }
    public List<Topic> getTopics() { return topics; }
    public void setTopics(List<Topic> topics) {
        this.topics = topics != null ? new ArrayList<>(topics) : new ArrayList<>();
    }
    public List<Topic> getOpenTopics() { return openTopics; }
    public void setOpenTopics(List<Topic> openTopics) {
        this.openTopics = openTopics != null ? new ArrayList<>(openTopics) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "MeetingSeries{id='" + id + "', minutes=" + minutes + ", topics=" + topics.size()
                + ", openTopics=" + openTopics.size() + "}";
    }
}
