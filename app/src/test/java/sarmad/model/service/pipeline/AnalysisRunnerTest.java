package sarmad.model.service.pipeline;

import org.junit.jupiter.api.Test;
import sarmad.model.domain.KeywordSet;
import sarmad.model.domain.RawPost;
import sarmad.model.repository.RunsRepo;
import sarmad.model.service.ingest.QuerySpec;
import sarmad.model.service.ingest.SocialConnector;
import sarmad.model.service.nlp.FingerprintExtractor;
import sarmad.model.service.nlp.Lexicon;
import sarmad.model.service.preprocess.DefaultPreprocessService;
import sarmad.model.service.search.SearchSettings;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AnalysisRunnerTest {

    private static SocialConnector burst() {
        return new SocialConnector() {
            @Override public String id() { return "burst"; }

            @Override public Stream<RawPost> fetch(QuerySpec spec) {
                List<RawPost> out = new ArrayList<>();
                Instant t = Instant.parse("2024-05-01T16:00:00Z");
                for (int i = 0; i < 500; i++) {
                    out.add(new RawPost("p" + i, null, "u", "مضاربة", t.plusSeconds(30L * i).toString(), false, Map.of()));
                }
                return out.stream();
            }
        };
    }

    @Test
    void cancellingTheFutureStopsAPacedRun() throws Exception {
        RunsRepo runsRepo = mock(RunsRepo.class);
        PipelineService pipeline = new PipelineService(List.of(burst()), new DefaultPreprocessService(),
                new FingerprintExtractor(Lexicon.empty()),
                SearchSettings.defaults().withPacing(Duration.ofSeconds(5)), runsRepo);
        CountDownLatch firstStep = new CountDownLatch(1);

        try (AnalysisRunner runner = new AnalysisRunner(pipeline)) {
            Future<RunResult> future = runner.submit(RunConfig.forKeywords(KeywordSet.of("مضاربة"), 3),
                    p -> firstStep.countDown());

            assertTrue(firstStep.await(10, TimeUnit.SECONDS));
            assertTrue(future.cancel(true));
            assertTrue(future.isCancelled());
        }
        verify(runsRepo, never()).saveRun(any());
    }

    @Test
    void completedRunIsReturned() throws Exception {
        RunsRepo runsRepo = mock(RunsRepo.class);
        PipelineService pipeline = new PipelineService(List.of(burst()), new DefaultPreprocessService(),
                new FingerprintExtractor(Lexicon.empty()), SearchSettings.defaults(), runsRepo);

        try (AnalysisRunner runner = new AnalysisRunner(pipeline)) {
            RunResult result = runner.submit(RunConfig.forKeywords(KeywordSet.of("مضاربة"), 3), p -> { })
                    .get(10, TimeUnit.SECONDS);

            assertEquals("p0", result.search().source().orElseThrow().id());
        }
        verify(runsRepo).saveRun(any());
    }
}
