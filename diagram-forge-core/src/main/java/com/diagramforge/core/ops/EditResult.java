package com.diagramforge.core.ops;

/**
 * Outcome of applying a batch of edit operations.
 *
 * <p>Exactly one of {@code xml} and {@code error} is set. On failure none of the batch's
 * operations are reflected anywhere.
 *
 * @param xml resulting document, or {@code null} on failure
 * @param error error message, or {@code null} on success
 * @param failedIndex zero-based index of the failing operation, or {@code -1}
 */
public record EditResult(String xml, String error, int failedIndex) {

    public static EditResult success(String xml) {
        return new EditResult(xml, null, -1);
    }

    public static EditResult failure(String error) {
        return new EditResult(null, error, -1);
    }

    public static EditResult failure(String error, int failedIndex) {
        return new EditResult(null, error, failedIndex);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
