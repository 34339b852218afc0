package sarmad.model.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/** Half-open time interval {@code [low, high)}. */
public record SearchWindow(Instant low, Instant high) {
    public SearchWindow {
        Objects.requireNonNull(low, "low");
        Objects.requireNonNull(high, "high");
        if (!low.isBefore(high)) {
            throw new IllegalArgumentException("window low must precede high: [" + low + ", " + high + ")");
        }
    }

    public Duration duration() { return Duration.between(low, high); }

    /** Exact midpoint, nanosecond precision. */
    public Instant midpoint() { return low.plus(duration().dividedBy(2)); }

    public boolean contains(Instant t) {
        return t != null && !t.isBefore(low) && t.isBefore(high);
    }

    public SearchWindow leftHalf() { return new SearchWindow(low, midpoint()); }

    public SearchWindow rightHalf() { return new SearchWindow(midpoint(), high); }

    /** True when every instant of this window also lies in {@code other}. */
    public boolean within(SearchWindow other) {
        return !low.isBefore(other.low) && !high.isAfter(other.high);
    }
}
