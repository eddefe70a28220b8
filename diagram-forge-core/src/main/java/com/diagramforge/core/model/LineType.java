package com.diagramforge.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Connector routing kinds.
 */
public enum LineType {
    STRAIGHT("straight"),
    ORTHOGONAL("orthogonal"),
    CURVED("curved"),
    ENTITY_RELATION("entityRelation");

    private final String wireName;

    LineType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
