package sarmad.collector.config;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CollectorConfigTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-02T08:30:00Z"), ZoneOffset.UTC);

    @Test
    void defaultsToYesterdayAfternoon() {
        CollectorConfig cfg = CollectorConfig.fromArgs(new String[0], clock);

        assertEquals(Instant.parse("2024-05-01T14:00:00Z"), cfg.base);
        assertEquals(CollectorConfig.DEFAULT_LOCATION, cfg.location);
        assertEquals(2500, cfg.eventPosts);
        assertEquals(1000, cfg.dailyPosts);
        assertTrue(cfg.includeEvent);
        assertEquals("synthetic", cfg.collection);
    }

    @Test
    void readsFlags() {
        CollectorConfig cfg = CollectorConfig.fromArgs(new String[]{
                "--collection", "demo", "--base", "2024-06-01T10:00:00Z", "--location", "العليا",
                "--event", "false", "--dailyPosts", "50", "--seed", "9", "--keywords", "a, b"}, clock);

        assertEquals("demo", cfg.collection);
        assertEquals(Instant.parse("2024-06-01T10:00:00Z"), cfg.base);
        assertEquals("العليا", cfg.location);
        assertFalse(cfg.includeEvent);
        assertEquals(50, cfg.dailyPosts);
        assertEquals(9L, cfg.seed);
        assertEquals(List.of("a", "b"), cfg.keywords);
    }

    @Test
    void badBaseIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CollectorConfig.fromArgs(new String[]{"--base", "tomorrow"}, clock));
    }
}
