package sarmad.model.service.nlp;

import java.util.*;

/**
 * Accumulates unigram, bigram and hashtag counts. Bigrams never span two posts.
 * Maps keep insertion order so ranking can break ties by first appearance.
 * Not thread-safe; use one instance per analysis.
 */
public class FrequencyAnalyzer {
    private final Map<String, Integer> unigrams = new LinkedHashMap<>();
    private final Map<String, Integer> bigrams = new LinkedHashMap<>();
    private final Map<String, Integer> hashtags = new LinkedHashMap<>();
    private int totalTokens;

    /** Adds the (already filtered) tokens of one post. */
    public void addTokens(List<String> tokens) {
        if (tokens == null) return;
        for (int i = 0; i < tokens.size(); i++) {
            unigrams.merge(tokens.get(i), 1, Integer::sum);
            if (i > 0) bigrams.merge(tokens.get(i - 1) + " " + tokens.get(i), 1, Integer::sum);
        }
        totalTokens += tokens.size();
    }

    public void addHashtags(List<String> tags) {
        if (tags == null) return;
        for (String t : tags) hashtags.merge(t, 1, Integer::sum);
    }

    public Map<String, Integer> unigrams() { return Collections.unmodifiableMap(unigrams); }
    public Map<String, Integer> bigrams() { return Collections.unmodifiableMap(bigrams); }
    public Map<String, Integer> hashtags() { return Collections.unmodifiableMap(hashtags); }
    public int totalTokens() { return totalTokens; }

    /** Keys by descending count; equal counts keep map (first-encountered) order. */
    public static List<String> rank(Map<String, Integer> freq) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(freq.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed()); // stable
        List<String> out = new ArrayList<>(entries.size());
        for (var e : entries) out.add(e.getKey());
        return out;
    }

    public static List<String> top(Map<String, Integer> freq, int n) {
        List<String> ranked = rank(freq);
        return ranked.subList(0, Math.min(Math.max(0, n), ranked.size()));
    }
}
