package sarmad.collector.model;

import com.google.gson.annotations.SerializedName;

import java.time.Instant;
import java.util.List;

/** One post as written to a collection file; field names follow the X API v2 payload. */
public final class RawRecord {
    public final String id;
    @SerializedName("conversation_id") public final String conversationId;
    @SerializedName("author_id") public final String authorId;
    public final Author author;
    public final String text;
    @SerializedName("created_at") public final Instant createdAt;
    public final List<Media> media;
    @SerializedName("is_source") public final boolean isSource;
    public final String type;                       // null for top-level posts
    @SerializedName("in_reply_to_user_id") public final String inReplyToUserId;

    public RawRecord(String id, String conversationId, Author author, String text, Instant createdAt,
                     List<Media> media, boolean isSource, String type, String inReplyToUserId) {
        this.id = id;
        this.conversationId = conversationId == null ? id : conversationId;
        this.authorId = author.id;
        this.author = author;
        this.text = text;
        this.createdAt = createdAt;
        this.media = media == null ? List.of() : List.copyOf(media);
        this.isSource = isSource;
        this.type = type;
        this.inReplyToUserId = inReplyToUserId;
    }

    public boolean hasMedia() { return !media.isEmpty(); }

    public static final class Author {
        public final String id;
        public final String username;
        public final String name;
        public Author(String id, String username, String name) {
            this.id = id; this.username = username; this.name = name;
        }
    }

    public static final class Media {
        public final String type;                  // video | photo
        @SerializedName("media_key") public final String mediaKey;
        public final String url;
        public Media(String type, String mediaKey, String url) {
            this.type = type; this.mediaKey = mediaKey; this.url = url;
        }
    }
}
