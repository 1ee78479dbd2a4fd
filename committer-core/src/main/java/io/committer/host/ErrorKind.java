package io.committer.host;

import io.committer.UnrecoverableException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Classification of a failure raised by a committer or factory.
 *
 * <p>Classification happens once, where the failure leaves user code; everything downstream
 * reads the tag instead of inspecting exception types.
 */
public enum ErrorKind {

    /** Retried with the strategy that matches the failing operation. */
    RECOVERABLE,

    /** Stops the affected unit permanently. */
    UNRECOVERABLE;

    /**
     * Classifies a failure. {@link UnrecoverableException}, JVM errors and interruption are
     * unrecoverable; everything else is recoverable.
     *
     * @param failure the failure, possibly wrapped by a future
     * @return the kind of the underlying failure
     */
    public static ErrorKind classify(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof UnrecoverableException
                || cause instanceof VirtualMachineError
                || cause instanceof LinkageError
                || cause instanceof InterruptedException) {
            return UNRECOVERABLE;
        }
        return RECOVERABLE;
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} layers added by
     * futures.
     *
     * @param failure the failure
     * @return the innermost cause carried by those layers
     */
    public static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
