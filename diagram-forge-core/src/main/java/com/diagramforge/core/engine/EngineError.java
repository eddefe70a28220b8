package com.diagramforge.core.engine;

import com.diagramforge.core.validate.StructuralViolation;

import java.util.Objects;

/**
 * Failure reported by {@link DiagramEngine}.
 */
public sealed interface EngineError permits EngineError.ParseError, EngineError.StructuralError,
    EngineError.OperationError {

    String message();

    /**
     * The document is not well-formed XML.
     *
     * @param message parser message
     */
    record ParseError(String message) implements EngineError {
        public ParseError {
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    /**
     * The document parses but violates a structural invariant.
     *
     * @param violation the first violation found
     */
    record StructuralError(StructuralViolation violation) implements EngineError {
        public StructuralError {
            Objects.requireNonNull(violation, "violation must not be null");
        }

        @Override
        public String message() {
            return violation.describe();
        }
    }

    /**
     * A requested operation could not be performed.
     *
     * @param message what failed
     * @param failedIndex index of the failing edit operation, or {@code -1}
     */
    record OperationError(String message, int failedIndex) implements EngineError {
        public OperationError {
            Objects.requireNonNull(message, "message must not be null");
        }

        public OperationError(String message) {
            this(message, -1);
        }
    }
}
