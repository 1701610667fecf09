package io.memlite.core;

/**
 * Malformed input: blank ids, mismatched merge targets, unknown enum names, bad vectors.
 * Always thrown synchronously to the caller; never retried.
 */
public class ValidationException extends IllegalArgumentException {
    public ValidationException(String message) {
        super(message);
    }
}
