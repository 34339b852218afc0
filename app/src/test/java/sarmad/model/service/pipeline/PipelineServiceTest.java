package sarmad.model.service.pipeline;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import sarmad.model.domain.KeywordSet;
import sarmad.model.domain.RawPost;
import sarmad.model.domain.Strategy;
import sarmad.model.repository.RunsRepo;
import sarmad.model.service.ingest.QuerySpec;
import sarmad.model.service.ingest.SocialConnector;
import sarmad.model.service.nlp.FingerprintExtractor;
import sarmad.model.service.nlp.Lexicon;
import sarmad.model.service.preprocess.DefaultPreprocessService;
import sarmad.model.service.search.SearchSettings;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineServiceTest {

    @Mock
    private SocialConnector connector;

    @Mock
    private RunsRepo runsRepo;

    private PipelineService pipeline;

    @BeforeEach
    void setup() {
        pipeline = new PipelineService(List.of(connector), new DefaultPreprocessService(),
                new FingerprintExtractor(new Lexicon(Set.of("في"), Set.of())), SearchSettings.defaults(), runsRepo);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private static List<RawPost> event() {
        List<RawPost> out = new ArrayList<>();
        out.add(new RawPost("100", "100", "u0", "المقطع كامل", "2024-05-01T14:15:00Z", true, Map.of()));
        for (int i = 0; i < 10; i++) {
            out.add(new RawPost("r" + i, "r" + i, "u" + i, "مضاربة في النسيم",
                    "2024-05-01T15:" + (10 + i) + ":00Z", false, Map.of()));
        }
        out.add(new RawPost("bad", null, "u9", "مضاربة", "not a time", false, Map.of()));
        return out;
    }

    @Test
    void runExtractsKeywordsAttributesAndSaves() {
        when(connector.fetch(any())).thenReturn(event().stream());
        when(connector.id()).thenReturn("mock");

        RunResult result = pipeline.run(RunConfig.forKeywords(KeywordSet.empty(), 2));

        assertEquals(KeywordSet.of("مضاربة", "النسيم"), result.fingerprint().keywords());
        assertTrue(result.search().found());
        assertEquals("100", result.search().source().orElseThrow().id());

        ArgumentCaptor<RunSummary> saved = ArgumentCaptor.forClass(RunSummary.class);
        verify(runsRepo).saveRun(saved.capture());
        assertEquals(11, saved.getValue().ingested());
        assertEquals(1, saved.getValue().skipped());
        assertEquals(List.of("مضاربة", "النسيم"), saved.getValue().keywords());
        assertEquals(Strategy.TEMPORAL_BISECTION, saved.getValue().strategy());
    }

    @Test
    void referenceTimeAfterEveryPostWidensKeywordExtraction() {
        when(connector.fetch(any())).thenReturn(event().stream());
        when(connector.id()).thenReturn("mock");
        RunConfig late = new RunConfig("late", QuerySpec.all(), KeywordSet.empty(), Optional.empty(),
                Instant.parse("2024-05-02T00:00:00Z"), 3);

        RunResult result = pipeline.run(late);

        assertTrue(result.fingerprint().keywords().isEmpty());
        assertEquals(0, result.fingerprint().postsAnalyzed());
        assertTrue(result.search().found());
        assertEquals("100", result.search().source().orElseThrow().id());
        assertEquals(Strategy.TEMPORAL_BISECTION, result.summary().strategy());
    }

    @Test
    void reportedPostIsTraced() {
        List<RawPost> posts = new ArrayList<>(event());
        posts.add(new RawPost("101", "100", "u7", "وين صار؟", "2024-05-01T14:30:00Z", false, Map.of()));
        when(connector.fetch(any())).thenReturn(posts.stream());
        when(connector.id()).thenReturn("mock");

        RunResult result = pipeline.run(RunConfig.forReport("101", 3));

        assertEquals(Strategy.TRACE_CONVERSATION, result.summary().strategy());
        assertEquals("100", result.summary().sourcePostId());
    }

    @Test
    void cancelledRunIsNotSaved() {
        when(connector.fetch(any())).thenReturn(event().stream());
        when(connector.id()).thenReturn("mock");
        Thread.currentThread().interrupt();

        assertThrows(CancellationException.class,
                () -> pipeline.run(RunConfig.forKeywords(KeywordSet.of("مضاربة"), 3)));
        verify(runsRepo, never()).saveRun(any());
    }
}
