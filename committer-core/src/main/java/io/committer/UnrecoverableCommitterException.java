package io.committer;

/**
 * Thrown by a {@link Committer} to stop the host from retrying its work.
 *
 * <p>The host stops the unit that owns the committer, closes the committer, and reports the
 * failure.
 */
public class UnrecoverableCommitterException extends UnrecoverableException {

    public UnrecoverableCommitterException(String message) {
        super(message);
    }

    public UnrecoverableCommitterException(String message, Throwable cause) {
        super(message, cause);
    }
}
