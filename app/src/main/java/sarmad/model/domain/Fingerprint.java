package sarmad.model.domain;

import java.util.List;
import java.util.Map;

/**
 * Semantic fingerprint of an event. Frequency maps keep first-encountered order.
 */
public record Fingerprint(
    KeywordSet keywords,
    List<String> topBigrams,
    Map<String, Integer> unigramFrequency,
    Map<String, Integer> bigramFrequency,
    Map<String, Integer> hashtagFrequency,
    int postsAnalyzed,
    int totalTokens
) {}
