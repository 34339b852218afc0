package sarmad.model.service.preprocess;

/** A raw record that cannot become a {@link sarmad.model.domain.Post}. */
public class MalformedPostException extends IllegalArgumentException {
    private final String postId;

    public MalformedPostException(String postId, String message) {
        super(message);
        this.postId = postId;
    }

    public MalformedPostException(String postId, String message, Throwable cause) {
        super(message, cause);
        this.postId = postId;
    }

    public String postId() { return postId; }
}
