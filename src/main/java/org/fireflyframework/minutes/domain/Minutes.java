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
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A minutes document of a meeting series.
 * <p>
 * Field names follow the stored document layout ({@code _id}, {@code meetingSeries_id},
 * {@code isFinalized}, ...); Jackson maps fields directly so the bean accessors stay Java-style.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Minutes {

    public static final String FIELD_MEETING_SERIES_ID = "meetingSeries_id";
    public static final String FIELD_IS_FINALIZED = "isFinalized";
    public static final String FIELD_IS_UNFINALIZED = "isUnfinalized";
    public static final String FIELD_FINALIZED_AT = "finalizedAt";
    public static final String FIELD_FINALIZED_BY = "finalizedBy";

    @JsonProperty("_id")
    private String id;
    @JsonProperty(FIELD_MEETING_SERIES_ID)
    private String meetingSeriesId;
    private LocalDate date;
    @JsonProperty(FIELD_IS_FINALIZED)
    private boolean finalized;
    @JsonProperty(FIELD_IS_UNFINALIZED)
    private boolean unfinalized;
    private List<Topic> topics = new ArrayList<>();
    private Instant finalizedAt;
    private String finalizedBy;

    public Minutes() {
    }

    public Minutes(String meetingSeriesId, LocalDate date) {
        this.meetingSeriesId = meetingSeriesId;
        this.date = date;
    }

    public FinalizationStatus status() {
        return FinalizationStatus.of(finalized, unfinalized);
    }

    public String parentMeetingSeriesId() {
        return meetingSeriesId;
    }

    /**
     * Loads the owning series, including its minutes.
     *
     * @return Mono emitting the series, or empty if it does not exist
     */
    public Mono<MeetingSeries> parentMeetingSeries(WorkflowEntityLoader loader) {
        if (meetingSeriesId == null || meetingSeriesId.isEmpty()) {
            return Mono.empty();
        }
        return loader.loadMeetingSeries(meetingSeriesId);
    }

    public Minutes withTopic(Topic topic) {
        topics.add(topic);
        return this;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getMeetingSeriesId() { return meetingSeriesId; }
    public void setMeetingSeriesId(String meetingSeriesId) { this.meetingSeriesId = meetingSeriesId; }
    public LocalDate getDate() { return date; }
    public void setDate(LocalDate date) { this.date = date; }
    public boolean isFinalized() { return finalized; }
    public void setFinalized(boolean finalized) { this.finalized = finalized; }
    public boolean isUnfinalized() { return unfinalized; }
    public void setUnfinalized(boolean unfinalized) { this.unfinalized = unfinalized; }
    public List<Topic> getTopics() { return topics; }
    public void setTopics(List<Topic> topics) {
        this.topics = topics != null ? new ArrayList<>(topics) : new ArrayList<>();
    }
    public Instant getFinalizedAt() { return finalizedAt; }
    public void setFinalizedAt(Instant finalizedAt) { this.finalizedAt = finalizedAt; }
    public String getFinalizedBy() { return finalizedBy; }
    public void setFinalizedBy(String finalizedBy) { this.finalizedBy = finalizedBy; }

    @Override
    public String toString() {
        return "Minutes{id='" + id + "', meetingSeriesId='" + meetingSeriesId + "', date=" + date
                + ", status=" + status() + "}";
    }
}
