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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A discussion topic. Minutes carry their own topics; a meeting series mirrors the merged topics of its
 * finalized minutes.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Topic {

    @JsonProperty("_id")
    private String id;
    private String subject;
    @JsonProperty("isOpen")
    private boolean open = true;
    private List<InfoItem> infoItems = new ArrayList<>();

    public Topic() {
    }

    public Topic(String id, String subject, boolean open) {
        this.id = id;
        this.subject = subject;
        this.open = open;
    }

    public Topic copy() {
        Topic copy = new Topic(id, subject, open);
        for (InfoItem item : infoItems) {
            copy.infoItems.add(item.copy());
        }
        return copy;
    }

    public Topic withItem(InfoItem item) {
        infoItems.add(item);
        return this;
    }

    public long countActionItems() {
        return infoItems.stream().filter(InfoItem::isActionItem).count();
    }

    public long countInfoItems() {
        return infoItems.stream().filter(item -> !item.isActionItem()).count();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getSubject() { return subject; }
    public void setSubject(String subject) { this.subject = subject; }
    public boolean isOpen() { return open; }
    public void setOpen(boolean open) { this.open = open; }
    public List<InfoItem> getInfoItems() { return infoItems; }
    public void setInfoItems(List<InfoItem> infoItems) {
        this.infoItems = infoItems != null ? new ArrayList<>(infoItems) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Topic that)) return false;
        return open == that.open
                && Objects.equals(id, that.id)
                && Objects.equals(subject, that.subject)
                && Objects.equals(infoItems, that.infoItems);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, subject, open, infoItems);
    }

    @Override
    public String toString() {
        return "Topic{id='" + id + "', subject='" + subject + "', open=" + open + ", items=" + infoItems.size() + "}";
    }
}
