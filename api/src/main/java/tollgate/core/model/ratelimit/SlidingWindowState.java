package tollgate.core.model.ratelimit;

import java.util.Arrays;

/**
 * Sliding window log state: the admission timestamps of every request counted in the
 * trailing window, oldest first.
 *
 * <p>Instances are immutable. Every mutation returns a new state.
 *
 * @param admittedAtMillis admission timestamps in epoch milliseconds, ascending
 */
public record SlidingWindowState(long[] admittedAtMillis) implements RateLimitState {

    private static final long[] EMPTY = new long[0];

    /**
     * Creates a sliding window state, copying the timestamps.
     */
    public SlidingWindowState {
        admittedAtMillis = admittedAtMillis == null ? EMPTY : admittedAtMillis.clone();
    }

    /**
     * Creates an empty state.
     *
     * @return a state with no counted requests
     */
    public static SlidingWindowState empty() {
        return new SlidingWindowState(EMPTY);
    }

    /**
     * Returns a new state without the timestamps at or before the cutoff.
     *
     * @param cutoffMillis timestamps {@code <= cutoffMillis} fall outside the window
     * @return the pruned state, or this state if nothing was pruned
     */
    public SlidingWindowState prune(long cutoffMillis) {
        var first = 0;
        while (first < admittedAtMillis.length && admittedAtMillis[first] <= cutoffMillis) {
            first++;
        }
        if (first == 0) {
            return this;
        }
        return new SlidingWindowState(Arrays.copyOfRange(admittedAtMillis, first, admittedAtMillis.length));
    }

    /**
     * Returns a new state with one more admitted request.
     *
     * @param nowMillis the admission timestamp
     * @return the new state
     */
    public SlidingWindowState append(long nowMillis) {
        final var next = Arrays.copyOf(admittedAtMillis, admittedAtMillis.length + 1);
        // Clock steps backwards must not break the ascending order
        final var last = admittedAtMillis.length == 0 ? nowMillis : admittedAtMillis[admittedAtMillis.length - 1];
        next[admittedAtMillis.length] = Math.max(nowMillis, last);
        return new SlidingWindowState(next);
    }

    /**
     * Returns the oldest counted timestamp.
     *
     * @return the oldest timestamp
     * @throws IllegalStateException if the window is empty
     */
    public long oldestMillis() {
        if (admittedAtMillis.length == 0) {
            throw new IllegalStateException("No requests in window");
        }
        return admittedAtMillis[0];
    }

    @Override
    public long[] admittedAtMillis() {
        return admittedAtMillis.clone();
    }

    @Override
    public int requestCount() {
        return admittedAtMillis.length;
    }

    @Override
    public long timestampMillis() {
        return admittedAtMillis.length == 0 ? 0 : admittedAtMillis[0];
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof SlidingWindowState that && Arrays.equals(admittedAtMillis, that.admittedAtMillis);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(admittedAtMillis);
    }

    @Override
    public String toString() {
        return "SlidingWindowState[count=" + admittedAtMillis.length + ", oldest=" + timestampMillis() + "]";
    }
}
