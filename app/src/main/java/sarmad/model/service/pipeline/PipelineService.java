package sarmad.model.service.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sarmad.model.domain.*;
import sarmad.model.repository.RunsRepo;
import sarmad.model.repository.SQLite;
import sarmad.model.service.config.AppConfig;
import sarmad.model.service.ingest.FileConnector;
import sarmad.model.service.ingest.SocialConnector;
import sarmad.model.service.nlp.FingerprintExtractor;
import sarmad.model.service.nlp.Lexicon;
import sarmad.model.service.nlp.LexiconLoader;
import sarmad.model.service.nlp.Tokenizer;
import sarmad.model.service.preprocess.DefaultPreprocessService;
import sarmad.model.service.preprocess.MalformedPostException;
import sarmad.model.service.preprocess.PreprocessService;
import sarmad.model.service.search.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Pipeline:
 *  1) fetch from connectors
 *  2) preprocess; malformed records are logged and skipped
 *  3) fingerprint the corpus
 *  4) attribute (conversation trace, else bisection)
 *  5) save the run summary, only for runs that complete
 */
public class PipelineService {
    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    /* ---------- Factory ---------- */

    public static PipelineService createDefault(AppConfig cfg) {
        log.info("collections={}", cfg.collectionsRoot().toAbsolutePath());
        return new PipelineService(
                List.of(new FileConnector(cfg.collectionsRoot())),
                new DefaultPreprocessService(),
                extractorFor(cfg),
                cfg.searchSettings(),
                new RunsRepo(openDatabase(cfg.dbPath())));
    }

    /** Creates the parent directory if needed and applies the migration. */
    public static SQLite openDatabase(Path dbPath) {
        Path abs = dbPath.toAbsolutePath();
        try {
            if (abs.getParent() != null) Files.createDirectories(abs.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        log.info("db={}", abs);
        SQLite db = new SQLite(abs.toString());
        db.migrate();
        return db;
    }

    public static FingerprintExtractor extractorFor(AppConfig cfg) {
        Lexicon lexicon = LexiconLoader.load(cfg.lexiconDir().orElse(null));
        return new FingerprintExtractor(new Tokenizer(), lexicon, cfg.analysis.topK);
    }

    /* ---------- Fields ---------- */

    private final List<SocialConnector> connectors;
    private final PreprocessService preprocess;
    private final FingerprintExtractor extractor;
    private final Attributor attributor;
    private final RunsRepo runsRepo;

    public PipelineService(List<SocialConnector> connectors,
                           PreprocessService preprocess,
                           FingerprintExtractor extractor,
                           SearchSettings settings,
                           RunsRepo runsRepo) {
        this.connectors = List.copyOf(connectors);
        this.preprocess = Objects.requireNonNull(preprocess, "preprocess");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.attributor = new Attributor(new ConversationTracer(),
                new Bisector(new WindowCounter(), settings), extractor);
        this.runsRepo = runsRepo;
    }

    /* ---------- Public API ---------- */

    /** Attributor over this pipeline's extractor and search settings; shared with report investigation. */
    public Attributor attributor() { return attributor; }

    /** Fetch and preprocess only, for callers that attribute on their own. */
    public Corpus loadCorpus(RunConfig cfg) {
        return ingest(cfg).corpus;
    }

    public RunResult run(RunConfig cfg) {
        return run(cfg, ProgressSink.none());
    }

    /**
     * @throws java.util.concurrent.CancellationException if the calling thread is interrupted
     *         mid-search; nothing is saved in that case
     */
    public RunResult run(RunConfig cfg, ProgressSink sink) {
        Instant started = Instant.now();
        Ingested in = ingest(cfg);
        log.info("[{}] corpus={} skipped={}", cfg.runId(), in.corpus.size(), in.skipped);

        Fingerprint fp = extractor.extract(in.corpus, cfg.referenceTime(), cfg.topK());
        KeywordSet keywords = cfg.keywords().isEmpty() ? fp.keywords() : cfg.keywords();
        log.info("[{}] keywords={} bigrams={}", cfg.runId(), keywords, fp.topBigrams());

        // nothing after the reference time to fingerprint: let the attributor extract over the whole corpus
        Optional<KeywordSet> guide = Optional.of(keywords).filter(k -> !k.isEmpty());
        if (guide.isEmpty() && cfg.referenceTime() != null) {
            log.info("[{}] no keywords since {}, widening extraction to the whole corpus",
                    cfg.runId(), cfg.referenceTime());
        }
        SearchResult result = attributor.attribute(in.corpus,
                new AttributionRequest(cfg.reportedPostId(), guide), sink);

        RunSummary summary = new RunSummary(
                cfg.runId(), started, Instant.now(),
                in.corpus.size(), in.skipped,
                keywords.terms(),
                result.found(),
                result.source().map(Post::id).orElse(null),
                result.iterations(),
                result.strategy());
        if (runsRepo != null) runsRepo.saveRun(summary);
        log.info("[{}] found={} source={} strategy={} iterations={}", cfg.runId(),
                summary.found(), summary.sourcePostId(), summary.strategy(), summary.iterations());
        return new RunResult(summary, fp, result, in.corpus);
    }

    /* ---------- Helpers ---------- */

    private Ingested ingest(RunConfig cfg) {
        List<Post> posts = new ArrayList<>();
        int skipped = 0;
        for (SocialConnector c : connectors) {
            try (Stream<RawPost> s = c.fetch(cfg.query())) {
                for (RawPost raw : (Iterable<RawPost>) s::iterator) {
                    try {
                        posts.add(preprocess.preprocess(raw));
                    } catch (MalformedPostException e) {
                        skipped++;
                        log.warn("[{}] skipping {} from {}: {}", cfg.runId(), e.postId(), c.id(), e.getMessage());
                    }
                }
            }
        }
        return new Ingested(Corpus.of(posts), skipped);
    }

    private record Ingested(Corpus corpus, int skipped) {}
}
