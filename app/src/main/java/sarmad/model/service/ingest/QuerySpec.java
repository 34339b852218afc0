package sarmad.model.service.ingest;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/** Time bounds for a fetch; both ends inclusive and optional. */
public final class QuerySpec {
    private static final QuerySpec ALL = new QuerySpec(null, null);

    private final Instant from;
    private final Instant to;

    private QuerySpec(Instant from, Instant to) {
        if (from != null && to != null && to.isBefore(from)) {
            throw new IllegalArgumentException("to " + to + " is before from " + from);
        }
        this.from = from;
        this.to = to;
    }

    public static QuerySpec all() { return ALL; }

    public static QuerySpec between(Instant from, Instant to) { return new QuerySpec(from, to); }

    public Optional<Instant> from() { return Optional.ofNullable(from); }
    public Optional<Instant> to()   { return Optional.ofNullable(to); }

    public boolean accepts(Instant ts) {
        if (ts == null) return true;
        boolean geFrom = from == null || !ts.isBefore(from);
        boolean leTo   = to == null || !ts.isAfter(to);
        return geFrom && leTo;
    }

    @Override public String toString() {
        return "QuerySpec{from=" + from + ", to=" + to + "}";
    }

    @Override public int hashCode() { return Objects.hash(from, to); }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QuerySpec that)) return false;
        return Objects.equals(from, that.from) && Objects.equals(to, that.to);
    }
}
