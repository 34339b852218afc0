package sarmad.model.service.search;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import sarmad.model.domain.*;
import sarmad.model.service.nlp.FingerprintExtractor;
import sarmad.model.service.nlp.Lexicon;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static sarmad.model.Fixtures.*;

@ExtendWith(MockitoExtension.class)
class AttributorTest {

    @Mock
    private Bisector bisector;

    @Mock
    private FingerprintExtractor extractor;

    private Attributor attributor;

    private final Post source = media("100", "المقطع كامل", at("14:15"));
    private final Corpus corpus = Corpus.of(
            reply("101", "100", "وين صار هذا؟", at("14:40")),
            source,
            reply("102", "100", "الله يستر", at("14:22")),
            post("200", "مضاربة في النسيم", at("16:00")));

    @BeforeEach
    void setup() {
        attributor = new Attributor(new ConversationTracer(), bisector, extractor);
    }

    @Test
    void reportedReplyIsTracedToItsRoot() {
        List<SearchProgress> seen = new ArrayList<>();

        SearchResult r = attributor.attribute(corpus, AttributionRequest.forReport("101"), seen::add);

        assertTrue(r.found());
        assertEquals(source, r.source().orElseThrow());
        assertEquals(Strategy.TRACE_CONVERSATION, r.strategy());
        assertEquals(1, r.iterations());
        assertTrue(r.finalWindow().isEmpty());

        SearchProgress step = r.path().get(0);
        assertEquals(1, r.path().size());
        assertEquals(Decision.TRACE_CONVERSATION, step.decision());
        assertEquals(source.createdAt(), step.low());
        assertEquals(3, step.countInRange());
        assertEquals(Duration.ZERO, step.windowSize());
        assertEquals(r.path(), seen);
        verifyNoInteractions(bisector, extractor);
    }

    @Test
    void unknownReportedPostFallsBackToBisection() {
        KeywordSet kws = KeywordSet.of("مضاربة");
        SearchResult bisected = new SearchResult(true, Optional.of(source), 7, Optional.empty(), List.of(),
                Strategy.TEMPORAL_BISECTION);
        when(bisector.search(eq(corpus), eq(kws), any())).thenReturn(bisected);

        SearchResult r = attributor.attribute(corpus, AttributionRequest.forReport("999", kws));

        assertSame(bisected, r);
        verifyNoInteractions(extractor);
    }

    @Test
    void missingKeywordsAreExtracted() {
        KeywordSet extracted = KeywordSet.of("مضاربة", "النسيم");
        when(extractor.extract(corpus)).thenReturn(fingerprint(extracted));
        when(bisector.search(eq(corpus), eq(extracted), any())).thenReturn(SearchResult.notFound());

        attributor.attribute(corpus, AttributionRequest.unguided());

        verify(bisector).search(eq(corpus), eq(extracted), any());
    }

    @Test
    void noRootAndNoKeywordsIsNotFound() {
        when(extractor.extract(corpus)).thenReturn(fingerprint(KeywordSet.empty()));

        SearchResult r = attributor.attribute(corpus, AttributionRequest.forReport("999"));

        assertFalse(r.found());
        assertEquals(Strategy.NONE, r.strategy());
        verifyNoInteractions(bisector);
    }

    @Test
    void emptyCorpusIsNotFound() {
        SearchResult r = attributor.attribute(Corpus.empty(), AttributionRequest.forReport("101"));

        assertFalse(r.found());
        assertEquals(0, r.iterations());
        assertTrue(r.path().isEmpty());
    }

    @Test
    void endToEndWithRealComponentsPrefersTrace() {
        Attributor real = new Attributor(new ConversationTracer(), new Bisector(),
                new FingerprintExtractor(Lexicon.empty()));

        SearchResult traced = real.attribute(corpus, AttributionRequest.forReport("102"));
        SearchResult bisected = real.attribute(corpus, AttributionRequest.forKeywords(KeywordSet.of("مضاربة")));

        assertEquals(Strategy.TRACE_CONVERSATION, traced.strategy());
        assertEquals("100", traced.source().orElseThrow().id());
        assertEquals(Strategy.TEMPORAL_BISECTION, bisected.strategy());
        assertEquals("100", bisected.source().orElseThrow().id());
    }

    private static Fingerprint fingerprint(KeywordSet keywords) {
        return new Fingerprint(keywords, List.of(), Map.of(), Map.of(), Map.of(), 4, 0);
    }
}
