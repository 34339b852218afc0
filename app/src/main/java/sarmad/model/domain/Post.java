package sarmad.model.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A validated social post. {@code conversationId} equals {@code id} when the post
 * is itself the root of a thread.
 */
public record Post(
    String id,
    String conversationId,
    String authorId,
    String text,
    Instant createdAt,
    boolean hasMedia
) {
    public Post {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(createdAt, "createdAt");
        if (conversationId == null || conversationId.isBlank()) conversationId = id;
        if (text == null) text = "";
    }

    public boolean isThreadRoot() { return id.equals(conversationId); }

    public Post withMedia(boolean media) {
        return new Post(id, conversationId, authorId, text, createdAt, media);
    }
}
