package sarmad.model.service.pipeline;

import sarmad.model.domain.KeywordSet;
import sarmad.model.service.ingest.QuerySpec;

import java.time.Instant;
import java.util.Optional;

/**
 * One analysis run.
 *
 * @param keywords       empty means "extract from the corpus"
 * @param reportedPostId post to trace first, if any
 * @param referenceTime  fingerprint only posts from here on; null means all
 */
public record RunConfig(
    String runId,
    QuerySpec query,
    KeywordSet keywords,
    Optional<String> reportedPostId,
    Instant referenceTime,
    int topK
) {
    public RunConfig {
        if (runId == null || runId.isBlank()) runId = "run_" + System.currentTimeMillis();
        query = query == null ? QuerySpec.all() : query;
        keywords = keywords == null ? KeywordSet.empty() : keywords;
        reportedPostId = reportedPostId == null ? Optional.empty() : reportedPostId;
        if (topK <= 0) throw new IllegalArgumentException("topK must be positive: " + topK);
    }

    public static RunConfig forKeywords(KeywordSet keywords, int topK) {
        return new RunConfig(null, QuerySpec.all(), keywords, Optional.empty(), null, topK);
    }

    public static RunConfig forReport(String postId, int topK) {
        return new RunConfig(null, QuerySpec.all(), KeywordSet.empty(), Optional.ofNullable(postId), null, topK);
    }
}
