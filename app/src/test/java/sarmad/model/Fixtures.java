package sarmad.model;

import sarmad.model.domain.Post;

import java.time.Instant;

public final class Fixtures {
    public static final Instant BASE = Instant.parse("2024-05-01T14:00:00Z");

    private Fixtures() {}

    public static Instant at(String hhmm) {
        return Instant.parse("2024-05-01T" + hhmm + ":00Z");
    }

    public static Post post(String id, String text, Instant createdAt) {
        return new Post(id, id, "u" + id, text, createdAt, false);
    }

    public static Post media(String id, String text, Instant createdAt) {
        return new Post(id, id, "u" + id, text, createdAt, true);
    }

    public static Post reply(String id, String conversationId, String text, Instant createdAt) {
        return new Post(id, conversationId, "u" + id, text, createdAt, false);
    }
}
