package com.insightplatform.common.model;

/**
 * Identity of an insight subject within a store: cooldown and de-duplication key.
 */
public record EntityRef(EntityType type, String key) {

    public static EntityRef of(EntityType type, String key) {
        return new EntityRef(type, key);
    }
}
