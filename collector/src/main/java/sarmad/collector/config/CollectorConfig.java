package sarmad.collector.config;

import sarmad.collector.util.TimeUtil;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;

public final class CollectorConfig {
    public static final String DEFAULT_LOCATION = "النسيم";

    public final Path outRoot;          // e.g. data/collections
    public final String collection;     // sub-folder for this dataset
    public final List<String> keywords; // recorded in dataset.yaml
    public final Instant base;          // event clock starts here; source lands at base+15m
    public final String location;
    public final boolean includeEvent;
    public final int eventPosts;
    public final int dailyPosts;
    public final long seed;

    public CollectorConfig(Path outRoot, String collection, List<String> keywords, Instant base, String location,
                           boolean includeEvent, int eventPosts, int dailyPosts, long seed) {
        if (eventPosts < 0 || dailyPosts < 0) throw new IllegalArgumentException("post counts must be >= 0");
        this.outRoot = outRoot;
        this.collection = collection;
        this.keywords = List.copyOf(keywords);
        this.base = base;
        this.location = location;
        this.includeEvent = includeEvent;
        this.eventPosts = eventPosts;
        this.dailyPosts = dailyPosts;
        this.seed = seed;
    }

    public static CollectorConfig fromArgs(String[] args) {
        return fromArgs(args, Clock.systemUTC());
    }

    public static CollectorConfig fromArgs(String[] args, Clock clock) {
        Map<String, String> m = parseArgs(args);

        Path outRoot = Paths.get(m.getOrDefault("--outDir", "data/collections")).toAbsolutePath();
        String collection = m.getOrDefault("--collection", "synthetic");
        String location = m.getOrDefault("--location", DEFAULT_LOCATION);
        List<String> keywords = csv(m.getOrDefault("--keywords", "مضاربة," + location));
        Instant base = m.containsKey("--base") ? iso(m.get("--base")) : TimeUtil.defaultBase(clock);

        boolean event = !"false".equalsIgnoreCase(m.getOrDefault("--event", "true"));
        int eventPosts = Integer.parseInt(m.getOrDefault("--eventPosts", "2500"));
        int dailyPosts = Integer.parseInt(m.getOrDefault("--dailyPosts", "1000"));
        long seed = Long.parseLong(m.getOrDefault("--seed", "42"));

        return new CollectorConfig(outRoot, collection, keywords, base, location, event, eventPosts, dailyPosts, seed);
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String v = (i + 1 < args.length && !args[i + 1].startsWith("--")) ? args[++i] : "true";
                m.put(a, v);
            }
        }
        return m;
    }

    private static List<String> csv(String s) {
        if (s == null || s.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        for (String x : s.split("\\s*,\\s*")) if (!x.isBlank()) out.add(x.trim());
        return out;
    }

    private static Instant iso(String s) {
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("--base must be an ISO instant, got: " + s, e);
        }
    }
}
