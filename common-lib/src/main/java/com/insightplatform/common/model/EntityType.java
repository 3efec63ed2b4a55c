package com.insightplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Subject kind of an aggregate, signal or insight. Persisted by its lowercase {@link #key()}.
 */
public enum EntityType {

    QUERY("query"),
    TOPIC("topic"),
    PRODUCT("product");

    private final String key;

    EntityType(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static EntityType fromKey(String key) {
        for (EntityType type : values()) {
            if (type.key.equalsIgnoreCase(key) || type.name().equalsIgnoreCase(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown entity type: " + key);
    }
}
