package dev.ebullient.mud;

/**
 * The world model found itself in a state its locking should make impossible.
 * Fatal to the offending operation only.
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
