package sarmad.model.domain;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A violation report filed against one post. Nullable fields stay null until the
 * matching lifecycle step happens (resolvedAt, cancelReason, sourcePostId, analysisJson).
 */
public record Report(
    String id,
    String postUrl,
    String postId,
    String description,
    ReportStatus status,
    ReportSource source,
    String reporterName,
    String reporterPhone,
    String reporterId,
    Instant createdAt,
    Instant updatedAt,
    Instant resolvedAt,
    CancelReason cancelReason,
    String sourcePostId,
    String analysisJson
) {
    private static final Pattern STATUS_URL = Pattern.compile("(?:x\\.com|twitter\\.com)/\\w+/status/(\\d+)");
    private static final Pattern DIGITS = Pattern.compile("^\\d+$");

    public static Report create(String postUrl, String description, String reporterName,
                                String reporterPhone, String reporterId, ReportSource source) {
        Instant now = Instant.now();
        String id = UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT);
        String postId = extractPostId(postUrl);
        return new Report(id, postUrl, postId == null ? "" : postId, description,
                ReportStatus.PENDING, source == null ? ReportSource.PUBLIC : source,
                reporterName, reporterPhone, reporterId,
                now, now, null, null, null, null);
    }

    /** Post id from an x.com / twitter.com status URL, or the input itself when it is all digits. */
    public static String extractPostId(String url) {
        if (url == null) return null;
        String s = url.trim();
        Matcher m = STATUS_URL.matcher(s);
        if (m.find()) return m.group(1);
        return DIGITS.matcher(s).matches() ? s : null;
    }

    public boolean hasPostId() { return postId != null && !postId.isBlank(); }
}
