package sarmad.model.service.nlp;

import org.junit.jupiter.api.Test;
import sarmad.model.domain.Corpus;
import sarmad.model.domain.Fingerprint;
import sarmad.model.domain.KeywordSet;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static sarmad.model.Fixtures.*;

class FingerprintExtractorTest {

    private final FingerprintExtractor extractor =
            new FingerprintExtractor(new Lexicon(Set.of("في", "من"), Set.of("الله")));

    private Corpus sample() {
        return Corpus.of(
                post("1", "مضاربة في النسيم", at("14:10")),
                post("2", "مضاربة النسيم الله", at("14:20")),
                post("3", "مضاربة قوية الله الله", at("14:30")));
    }

    @Test
    void ranksKeywordsAndSkipsDenylistedTerms() {
        Fingerprint fp = extractor.extract(sample());

        assertEquals(KeywordSet.of("مضاربة", "النسيم", "قوية"), fp.keywords());
        assertEquals(3, fp.unigramFrequency().get("الله"));
        assertFalse(fp.unigramFrequency().containsKey("في"));
        assertEquals(3, fp.postsAnalyzed());
        assertEquals(9, fp.totalTokens());
    }

    @Test
    void mixedCaseLexiconEntriesStillMatch() {
        FingerprintExtractor mixed = new FingerprintExtractor(new Lexicon(Set.of("RT"), Set.of("Breaking")));
        Corpus corpus = Corpus.of(
                post("1", "rt breaking مضاربة", at("14:10")),
                post("2", "RT BREAKING مضاربة النسيم", at("14:20")));

        Fingerprint fp = mixed.extract(corpus);

        assertTrue(fp.unigramFrequency().keySet().stream().noneMatch(w -> w.equalsIgnoreCase("rt")));
        assertEquals(KeywordSet.of("مضاربة", "النسيم"), fp.keywords());
    }

    @Test
    void topBigramsBreakTiesByFirstAppearance() {
        Fingerprint fp = extractor.extract(sample());

        assertEquals(List.of("مضاربة النسيم", "النسيم الله", "مضاربة قوية", "قوية الله", "الله الله"),
                fp.topBigrams());
        assertEquals(2, fp.bigramFrequency().get("مضاربة النسيم"));
    }

    @Test
    void bigramsDoNotSpanPosts() {
        Fingerprint fp = extractor.extract(Corpus.of(
                post("1", "alpha beta", at("14:00")),
                post("2", "gamma delta", at("14:01"))));

        assertEquals(Set.of("alpha beta", "gamma delta"), fp.bigramFrequency().keySet());
    }

    @Test
    void sameCorpusGivesSameFingerprint() {
        assertEquals(extractor.extract(sample()), extractor.extract(sample()));
    }

    @Test
    void countsHashtagsWithoutMarker() {
        Fingerprint fp = extractor.extract(Corpus.of(
                post("1", "عاجل #مضاربة_النسيم", at("14:00")),
                post("2", "#مضاربة_النسيم", at("14:05"))));

        assertEquals(2, fp.hashtagFrequency().get("مضاربة_النسيم"));
    }

    @Test
    void referenceTimeExcludesOlderPosts() {
        Fingerprint fp = extractor.extract(sample(), at("14:15"), 3);

        assertEquals(2, fp.postsAnalyzed());
        assertEquals(2, fp.unigramFrequency().get("مضاربة"));
    }

    @Test
    void topKLimitsKeywordCount() {
        assertEquals(KeywordSet.of("مضاربة"), extractor.extract(sample(), null, 1).keywords());
    }

    @Test
    void emptyCorpusGivesEmptyFingerprint() {
        Fingerprint fp = extractor.extract(Corpus.empty());

        assertTrue(fp.keywords().isEmpty());
        assertTrue(fp.topBigrams().isEmpty());
        assertEquals(0, fp.postsAnalyzed());
    }
}
