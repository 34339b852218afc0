package sarmad.model.service.search;

import sarmad.model.domain.KeywordSet;

import java.util.Optional;

/**
 * What the caller knows: a reported post, keywords, or both. Missing keywords are
 * extracted from the corpus when bisection is needed.
 */
public record AttributionRequest(Optional<String> reportedPostId, Optional<KeywordSet> keywords) {
    public AttributionRequest {
        reportedPostId = reportedPostId == null ? Optional.empty() : reportedPostId.filter(s -> !s.isBlank());
        keywords = keywords == null ? Optional.empty() : keywords;
    }

    public static AttributionRequest forKeywords(KeywordSet keywords) {
        return new AttributionRequest(Optional.empty(), Optional.ofNullable(keywords));
    }

    public static AttributionRequest forReport(String postId) {
        return new AttributionRequest(Optional.ofNullable(postId), Optional.empty());
    }

    public static AttributionRequest forReport(String postId, KeywordSet keywords) {
        return new AttributionRequest(Optional.ofNullable(postId), Optional.ofNullable(keywords));
    }

    public static AttributionRequest unguided() {
        return new AttributionRequest(Optional.empty(), Optional.empty());
    }
}
