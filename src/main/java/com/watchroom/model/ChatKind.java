package com.watchroom.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChatKind {
    TEXT("text"),
    EMOJI("emoji");

    private final String wireName;

    ChatKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static ChatKind fromWireName(String value) {
        for (ChatKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown chat message type: " + value);
    }
}
