package com.diagramforge.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * One step of a process flow.
 *
 * @param label step label
 * @param status progress state, {@code null} for pending
 */
public record ProcessStep(String label, Status status) {
    public ProcessStep {
        Objects.requireNonNull(label, "label must not be null");
    }

    public enum Status {
        PENDING, ACTIVE, COMPLETED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }
}
