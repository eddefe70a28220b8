package com.diagramforge.core.ops;

/**
 * Thrown when a single edit operation cannot be applied to the document.
 */
public class DiagramOperationException extends RuntimeException {

    public DiagramOperationException(String message) {
        super(message);
    }
}
