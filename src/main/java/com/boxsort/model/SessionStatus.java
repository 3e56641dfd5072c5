package com.boxsort.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionStatus {
    ACTIVE,
    PAUSED,
    COMPLETED;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static SessionStatus fromWireName(String value) {
        for (SessionStatus status : values()) {
            if (status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown session status: " + value);
    }

    /**
     * Completed sessions are terminal; active and paused may move to each other or to completed.
     */
    public boolean canTransitionTo(SessionStatus target) {
        if (this == COMPLETED) {
            return false;
        }
        return this != target;
    }
}
