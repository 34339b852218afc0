package sarmad.model.service.nlp;

import sarmad.model.domain.Corpus;
import sarmad.model.domain.Fingerprint;
import sarmad.model.domain.KeywordSet;
import sarmad.model.domain.Post;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Crowd-echo fingerprinting: the most frequent meaningful words of the chatter
 * that follows an event.
 *
 * <ul>
 *   <li>only posts created at or after {@code referenceTime} are read (all when null)</li>
 *   <li>tokens: {@link Tokenizer}, then {@link StopWordFilter}</li>
 *   <li>keywords: unigrams by frequency minus the denylist, first {@code topK}</li>
 *   <li>bigrams: top 5; hashtags: full map</li>
 * </ul>
 * Stateless apart from its injected word lists; safe to share between threads.
 */
public class FingerprintExtractor {
    public static final int DEFAULT_TOP_K = 3;
    public static final int TOP_BIGRAMS = 5;

    private final Tokenizer tokenizer;
    private final StopWordFilter stopWords;
    private final Set<String> denylist;
    private final int defaultTopK;

    public FingerprintExtractor(Lexicon lexicon) {
        this(new Tokenizer(), lexicon, DEFAULT_TOP_K);
    }

    public FingerprintExtractor(Tokenizer tokenizer, Lexicon lexicon, int defaultTopK) {
        this.tokenizer = tokenizer;
        this.stopWords = new StopWordFilter(lexicon.stopWords());
        this.denylist = lexicon.denylist();
        this.defaultTopK = defaultTopK;
    }

    public Fingerprint extract(Corpus corpus) {
        return extract(corpus, null, defaultTopK);
    }

    public Fingerprint extract(Corpus corpus, Instant referenceTime, int topK) {
        Corpus eligible = corpus == null ? Corpus.empty() : corpus.since(referenceTime);

        FrequencyAnalyzer freq = new FrequencyAnalyzer();
        for (Post p : eligible.posts()) {
            freq.addHashtags(tokenizer.hashtags(p.text()));
            freq.addTokens(stopWords.filter(tokenizer.tokenize(p.text())));
        }

        List<String> keywords = new ArrayList<>();
        for (String w : FrequencyAnalyzer.rank(freq.unigrams())) {
            if (keywords.size() >= topK) break;
            if (!denylist.contains(w.toLowerCase(Locale.ROOT))) keywords.add(w);
        }

        return new Fingerprint(
                KeywordSet.of(keywords),
                List.copyOf(FrequencyAnalyzer.top(freq.bigrams(), TOP_BIGRAMS)),
                freq.unigrams(),
                freq.bigrams(),
                freq.hashtags(),
                eligible.size(),
                freq.totalTokens()
        );
    }
}
