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
 * An entry of a topic: either plain information or an action item with responsibles.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class InfoItem {

    public enum ItemType {
        INFO_ITEM,
        ACTION_ITEM
    }

    @JsonProperty("_id")
    private String id;
    private String subject;
    private ItemType itemType = ItemType.INFO_ITEM;
    @JsonProperty("isOpen")
    private boolean open;
    private List<String> responsibles = new ArrayList<>();

    public InfoItem() {
    }

    public InfoItem(String id, String subject, ItemType itemType, boolean open) {
        this.id = id;
        this.subject = subject;
        this.itemType = itemType;
        this.open = open;
    }

    public static InfoItem info(String id, String subject) {
        return new InfoItem(id, subject, ItemType.INFO_ITEM, false);
    }

    public static InfoItem action(String id, String subject, boolean open) {
        return new InfoItem(id, subject, ItemType.ACTION_ITEM, open);
    }

    public InfoItem copy() {
        InfoItem copy = new InfoItem(id, subject, itemType, open);
        copy.responsibles = new ArrayList<>(responsibles);
        return copy;
    }

    public boolean isActionItem() {
        return itemType == ItemType.ACTION_ITEM;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getSubject() { return subject; }
    public void setSubject(String subject) { this.subject = subject; }
    public ItemType getItemType() { return itemType; }
    public void setItemType(ItemType itemType) { this.itemType = itemType; }
    public boolean isOpen() { return open; }
    public void setOpen(boolean open) { this.open = open; }
    public List<String> getResponsibles() { return responsibles; }
    public void setResponsibles(List<String> responsibles) {
        this.responsibles = responsibles != null ? new ArrayList<>(responsibles) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InfoItem that)) return false;
        return open == that.open
                && Objects.equals(id, that.id)
                && Objects.equals(subject, that.subject)
                && itemType == that.itemType
                && Objects.equals(responsibles, that.responsibles);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, subject, itemType, open, responsibles);
    }

    @Override
    public String toString() {
        return "InfoItem{id='" + id + "', itemType=" + itemType + ", open=" + open + "}";
    }
}
