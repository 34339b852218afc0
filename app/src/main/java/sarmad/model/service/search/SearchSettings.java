package sarmad.model.service.search;

import java.time.Duration;
import java.util.Objects;

/**
 * Bisection knobs.
 *
 * @param iterationCap  hard stop on the number of halvings; the window reached is accepted
 * @param minWindow     stop once the window is no wider than this
 * @param padding       added before the earliest and after the latest post
 * @param pacing        sleep after each step so an observer can follow; zero disables it
 */
public record SearchSettings(int iterationCap, Duration minWindow, Duration padding, Duration pacing) {
    public static final int DEFAULT_ITERATION_CAP = 20;
    public static final Duration DEFAULT_MIN_WINDOW = Duration.ofMinutes(1);
    public static final Duration DEFAULT_PADDING = Duration.ofMinutes(30);

    public SearchSettings {
        Objects.requireNonNull(minWindow, "minWindow");
        Objects.requireNonNull(padding, "padding");
        pacing = pacing == null ? Duration.ZERO : pacing;
        if (iterationCap < 0) throw new IllegalArgumentException("iterationCap must be >= 0");
        if (minWindow.isNegative() || minWindow.isZero()) throw new IllegalArgumentException("minWindow must be positive");
        if (padding.isNegative()) throw new IllegalArgumentException("padding must not be negative");
        if (pacing.isNegative()) throw new IllegalArgumentException("pacing must not be negative");
    }

    public static SearchSettings defaults() {
        return new SearchSettings(DEFAULT_ITERATION_CAP, DEFAULT_MIN_WINDOW, DEFAULT_PADDING, Duration.ZERO);
    }

    public SearchSettings withPacing(Duration pacing) {
        return new SearchSettings(iterationCap, minWindow, padding, pacing);
    }
}
