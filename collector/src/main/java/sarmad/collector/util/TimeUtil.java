package sarmad.collector.util;

import java.time.*;
import java.time.format.DateTimeFormatter;

public final class TimeUtil {
    private TimeUtil() {}

    public static String yearMonthDay(Instant t) {
        return t.atZone(ZoneOffset.UTC).format(DateTimeFormatter.ofPattern("yyyy-MM-dd"));
    }

    /** Yesterday at 14:00 UTC. */
    public static Instant defaultBase(Clock clock) {
        return LocalDate.now(clock).minusDays(1).atTime(14, 0).toInstant(ZoneOffset.UTC);
    }

    public static Instant plusMinutes(Instant base, double minutes) {
        return base.plusMillis(Math.round(minutes * 60_000d));
    }
}
