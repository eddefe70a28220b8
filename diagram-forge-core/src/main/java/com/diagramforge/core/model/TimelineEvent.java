package com.diagramforge.core.model;

import java.util.Objects;

/**
 * One event on a timeline.
 *
 * @param label short event label
 * @param description optional longer description
 */
public record TimelineEvent(String label, String description) {
    public TimelineEvent {
        Objects.requireNonNull(label, "label must not be null");
    }
}
