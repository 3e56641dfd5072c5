package com.boxsort.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ScanEventType {
    SCAN("scan"),
    EXTRA_ITEM("extra_item"),
    UNDO("undo"),
    ERROR("error");

    private final String wireName;

    ScanEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
