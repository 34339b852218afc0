package sarmad.util;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

public final class TimeUtil {
    private static final Pattern EPOCH_MILLIS = Pattern.compile("^\\d{13}$");
    private static final Pattern EPOCH_SECONDS = Pattern.compile("^\\d{10}$");
    private static final List<DateTimeFormatter> NAIVE = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss")
    );

    private TimeUtil() {}

    /** ISO-8601 with Z or offset, epoch seconds or millis, or a zone-less date-time read as UTC. */
    public static Optional<Instant> parseInstant(String s) {
        if (s == null || s.isBlank()) return Optional.empty();
        String x = s.trim();

        if (EPOCH_MILLIS.matcher(x).matches()) return Optional.of(Instant.ofEpochMilli(Long.parseLong(x)));
        if (EPOCH_SECONDS.matcher(x).matches()) return Optional.of(Instant.ofEpochSecond(Long.parseLong(x)));

        try { return Optional.of(Instant.parse(x)); }
        catch (DateTimeParseException ignore) { /* try next format */ }

        try { return Optional.of(OffsetDateTime.parse(x).toInstant()); }
        catch (DateTimeParseException ignore) { /* try next format */ }

        for (DateTimeFormatter fmt : NAIVE) {
            try {
                return Optional.of(LocalDateTime.parse(x, fmt).toInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException ignore) { /* try next format */ }
        }
        return Optional.empty();
    }
}
