package io.committer.retry;

import java.time.Clock;
import java.util.Objects;

/**
 * Per-unit retry state over a shared, stateless {@link RetryStrategy}.
 *
 * <p>States:
 * <ul>
 *   <li>{@link State#IDLE} - no failure recorded since the last {@link #reset()}.</li>
 *   <li>{@link State#WAITING} - a delay was computed and has not yet elapsed.</li>
 *   <li>{@link State#READY} - the delay elapsed; the next attempt may run.</li>
 *   <li>{@link State#EXHAUSTED} - the strategy gave up. Terminal until {@link #reset()}.</li>
 * </ul>
 *
 * <p>This class is not thread-safe. Each tracker belongs to one unit, which never runs two
 * attempts at once.
 */
public final class RetryTracker {

    public enum State {
        IDLE,
        WAITING,
        READY,
        EXHAUSTED
    }

    private final RetryStrategy strategy;
    private final Clock clock;

    private int attempts;
    private boolean scheduled;
    private boolean exhausted;
    private long lastDelayMs;
    private long readyAtMs;

    public RetryTracker(RetryStrategy strategy) {
        this(strategy, Clock.systemUTC());
    }

    public RetryTracker(RetryStrategy strategy, Clock clock) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Records a failed attempt and asks the strategy for the next delay.
     *
     * @return {@link State#WAITING} if another attempt is allowed (see {@link #lastDelayMs()}),
     *     or {@link State#EXHAUSTED}
     * @throws IllegalStateException if the tracker is already exhausted
     */
    public State recordFailure() {
        if (exhausted) {
            throw new IllegalStateException("Retry budget already exhausted after " + attempts + " attempts");
        }
        attempts++;
        if (strategy.isExhausted(attempts)) {
            exhausted = true;
            scheduled = false;
            lastDelayMs = 0L;
            return State.EXHAUSTED;
        }
        schedule(strategy.computeDelayMs(attempts));
        return State.WAITING;
    }

    /**
     * Waits for a delay chosen by someone other than the strategy, without counting a failure.
     *
     * @param delayMs delay in milliseconds
     * @throws IllegalStateException if the tracker is exhausted
     */
    public void waitFor(long delayMs) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be >= 0, got: " + delayMs);
        }
        if (exhausted) {
            throw new IllegalStateException("Retry budget already exhausted after " + attempts + " attempts");
        }
        schedule(delayMs);
    }

    private void schedule(long delayMs) {
        long now = clock.millis();
        lastDelayMs = Math.max(0L, delayMs);
        readyAtMs = Long.MAX_VALUE - now < lastDelayMs ? Long.MAX_VALUE : now + lastDelayMs;
        scheduled = true;
    }

    /**
     * Clears the failure count after a successful attempt.
     */
    public void reset() {
        attempts = 0;
        scheduled = false;
        exhausted = false;
        lastDelayMs = 0L;
        readyAtMs = 0L;
    }

    public State state() {
        if (exhausted) {
            return State.EXHAUSTED;
        }
        if (!scheduled) {
            return State.IDLE;
        }
        return clock.millis() < readyAtMs ? State.WAITING : State.READY;
    }

    /**
     * Milliseconds until the next attempt may run; {@code 0} unless {@link State#WAITING}.
     */
    public long remainingDelayMs() {
        if (state() != State.WAITING) {
            return 0L;
        }
        return readyAtMs - clock.millis();
    }

    /** Number of failures recorded since the last {@link #reset()}. */
    public int attempts() {
        return attempts;
    }

    /** Delay computed by the last {@link #recordFailure()} or {@link #waitFor(long)}. */
    public long lastDelayMs() {
        return lastDelayMs;
    }
}
