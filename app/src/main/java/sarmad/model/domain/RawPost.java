package sarmad.model.domain;

import java.util.Map;

/** Post as read from a connector, before timestamp validation. */
public record RawPost(
    String id,
    String conversationId,
    String authorId,
    String text,
    String createdAt,
    boolean hasMedia,
    Map<String, Object> meta
) {}
