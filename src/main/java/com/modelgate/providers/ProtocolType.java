package com.modelgate.providers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ProtocolType {
    OPENAI_COMPATIBLE("openai-compatible"),
    ANTHROPIC("anthropic");

    private final String wireName;

    ProtocolType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ProtocolType fromWireName(String value) {
        for (var type : values()) {
            if (type.wireName.equals(value)) return type;
        }
        throw new IllegalArgumentException("Unknown provider type: " + value);
    }
}
