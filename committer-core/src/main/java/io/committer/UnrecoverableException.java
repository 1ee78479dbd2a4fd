package io.committer;

/**
 * Base type for failures that must not be retried.
 *
 * <p>Every other exception thrown by a {@link Committer} or {@link CommitterFactory} is treated
 * as recoverable and retried with the matching strategy. An {@code UnrecoverableException}
 * ends retrying for the affected unit at once: pending retries are abandoned and no further
 * commit or heartbeat calls are made.
 *
 * @see UnrecoverableCommitterException
 * @see UnrecoverableCommitterFactoryException
 */
public abstract class UnrecoverableException extends RuntimeException {

    protected UnrecoverableException(String message) {
        super(message);
    }

    protected UnrecoverableException(String message, Throwable cause) {
        super(message, cause);
    }
}
