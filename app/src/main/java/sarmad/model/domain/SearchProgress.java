package sarmad.model.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * One bisection step. {@code low}/{@code high} are the bounds after the decision,
 * {@code windowSize} the width of the window before it was narrowed.
 */
public record SearchProgress(
    int iteration,
    Instant low,
    Instant mid,
    Instant high,
    int countInRange,
    Decision decision,
    Duration windowSize
) {
    public long windowSizeMinutes() { return windowSize.toMinutes(); }
}
