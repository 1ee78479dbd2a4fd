package io.committer.host;

import java.util.Objects;

/**
 * Result of calling into a committer or factory: either the returned value or a classified
 * failure.
 *
 * <p>The adapters never let an exception escape; every call produces an {@code Attempt}.
 *
 * @param <T> type of the value on success
 * @see CommitterAdapter
 * @see CommitterFactoryAdapter
 */
public sealed interface Attempt<T> permits Attempt.Succeeded, Attempt.Failed {

    static <T> Attempt<T> succeeded(T value) {
        return new Succeeded<>(value);
    }

    /**
     * Creates a failed attempt, unwrapping future layers and classifying the cause.
     *
     * @param failure the failure
     * @param <T>     type of the value on success
     * @return the failed attempt
     */
    static <T> Attempt<T> failed(Throwable failure) {
        Throwable cause = ErrorKind.unwrap(Objects.requireNonNull(failure, "failure"));
        return new Failed<>(ErrorKind.classify(cause), cause);
    }

    /**
     * The call returned normally.
     *
     * @param value the returned value, may be {@code null} where the call allows it
     */
    record Succeeded<T>(T value) implements Attempt<T> {
    }

    /**
     * The call failed.
     *
     * @param kind  whether the failure may be retried
     * @param cause the failure
     */
    record Failed<T>(ErrorKind kind, Throwable cause) implements Attempt<T> {
        public Failed {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(cause, "cause");
        }

        public boolean isUnrecoverable() {
            return kind == ErrorKind.UNRECOVERABLE;
        }
    }
}
