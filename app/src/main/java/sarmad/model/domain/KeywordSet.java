package sarmad.model.domain;

import java.util.*;

/** Ordered, distinct, non-blank keywords. Immutable once built. */
public record KeywordSet(List<String> terms) implements Iterable<String> {
    private static final KeywordSet EMPTY = new KeywordSet(List.of());

    public KeywordSet {
        Set<String> out = new LinkedHashSet<>();
        if (terms != null) {
            for (String t : terms) {
                if (t == null) continue;
                String s = t.strip();
                if (!s.isEmpty()) out.add(s);
            }
        }
        terms = List.copyOf(out);
    }

    public static KeywordSet of(Collection<String> terms) {
        return new KeywordSet(terms == null ? List.of() : new ArrayList<>(terms));
    }

    public static KeywordSet of(String... terms) { return of(Arrays.asList(terms)); }

    public static KeywordSet empty() { return EMPTY; }

    public boolean isEmpty() { return terms.isEmpty(); }
    public int size() { return terms.size(); }

    /** True when {@code text} contains at least one keyword as a substring. */
    public boolean matches(String text) {
        if (text == null || text.isEmpty()) return false;
        for (String k : terms) if (text.contains(k)) return true;
        return false;
    }

    @Override public Iterator<String> iterator() { return terms.iterator(); }

    @Override public String toString() { return terms.toString(); }
}
