package com.pulse.observability;

/**
 * Thrown when a {@link ServiceIdentity} cannot be constructed from the supplied values.
 * <p>
 * Unchecked: an unnamed service is a programming error, never retried.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
