package io.committer;

/**
 * Thrown by a {@link CommitterFactory} when a committer can never be created for the
 * requested topic, partition and id.
 *
 * <p>Also raised by the host when the factory itself cannot be instantiated.
 */
public class UnrecoverableCommitterFactoryException extends UnrecoverableException {

    public UnrecoverableCommitterFactoryException(String message) {
        super(message);
    }

    public UnrecoverableCommitterFactoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
