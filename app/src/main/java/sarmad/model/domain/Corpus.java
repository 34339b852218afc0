package sarmad.model.domain;

import java.time.Instant;
import java.util.*;

/**
 * Read-only collection of posts. Iteration order is the order the posts were
 * supplied in; nothing here sorts them.
 */
public final class Corpus {
    private static final Corpus EMPTY = new Corpus(List.of());

    private final List<Post> posts;
    private final Map<String, Post> byId;

    private Corpus(List<Post> posts) {
        this.posts = List.copyOf(posts);
        Map<String, Post> idx = new HashMap<>();
        for (Post p : this.posts) idx.putIfAbsent(p.id(), p);
        this.byId = Collections.unmodifiableMap(idx);
    }

    public static Corpus of(Collection<Post> posts) {
        if (posts == null || posts.isEmpty()) return EMPTY;
        return new Corpus(new ArrayList<>(posts));
    }

    public static Corpus of(Post... posts) { return of(Arrays.asList(posts)); }

    public static Corpus empty() { return EMPTY; }

    public List<Post> posts() { return posts; }
    public int size() { return posts.size(); }
    public boolean isEmpty() { return posts.isEmpty(); }

    public Optional<Post> findById(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(byId.get(id));
    }

    public Optional<Instant> earliest() {
        return posts.stream().map(Post::createdAt).min(Comparator.naturalOrder());
    }

    public Optional<Instant> latest() {
        return posts.stream().map(Post::createdAt).max(Comparator.naturalOrder());
    }

    /** Posts created at or after {@code from}. */
    public Corpus since(Instant from) {
        if (from == null) return this;
        return of(posts.stream().filter(p -> !p.createdAt().isBefore(from)).toList());
    }

    @Override public String toString() { return "Corpus{size=" + posts.size() + "}"; }
}
