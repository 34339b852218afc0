package sarmad;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sarmad.model.domain.*;
import sarmad.model.repository.ReportsRepo;
import sarmad.model.repository.RunsRepo;
import sarmad.model.repository.SQLite;
import sarmad.model.service.config.AppConfig;
import sarmad.model.service.export.TraceCsvExporter;
import sarmad.model.service.ingest.FileConnector;
import sarmad.model.service.ingest.QuerySpec;
import sarmad.model.service.nlp.FrequencyAnalyzer;
import sarmad.model.service.pipeline.AnalysisRunner;
import sarmad.model.service.pipeline.PipelineService;
import sarmad.model.service.pipeline.RunConfig;
import sarmad.model.service.pipeline.RunResult;
import sarmad.model.service.preprocess.DefaultPreprocessService;
import sarmad.model.service.report.ReportService;
import sarmad.model.service.search.ProgressSink;
import sarmad.model.service.search.SearchLogFormatter;
import sarmad.model.service.search.SearchSettings;
import sarmad.model.service.stats.HourlyVolume;
import sarmad.model.service.stats.VolumeHistogram;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Usage:
 * <pre>
 * sarmad --collections data/collections [--keywords a,b] [--report URL|ID] [--from ISO] [--to ISO]
 *        [--pacing ms] [--topK n] [--csv trace.csv] [--volume]
 * sarmad --submit URL [--description text] [--reporter name] [--auto]
 * sarmad --investigate REPORT_ID [--collections dir] [--to ISO] [--pacing ms]
 * sarmad --cancel REPORT_ID [--reason not_violation|deleted|not_found]
 * sarmad --reports [--status pending|active|resolved|cancelled]
 * </pre>
 */
public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        run(parse(args), AppConfig.load(), System.out);
    }

    static void run(Map<String, String> arg, AppConfig cfg, PrintStream out) {
        Path collections = arg.containsKey("--collections") ? Path.of(arg.get("--collections")) : cfg.collectionsRoot();
        Instant to = arg.containsKey("--to") ? Instant.parse(arg.get("--to")) : null;
        SearchSettings settings = cfg.searchSettings();
        if (arg.containsKey("--pacing")) {
            settings = settings.withPacing(Duration.ofMillis(Long.parseLong(arg.get("--pacing"))));
        }

        SQLite db = PipelineService.openDatabase(cfg.dbPath());
        PipelineService pipeline = new PipelineService(
                List.of(new FileConnector(collections)),
                new DefaultPreprocessService(),
                PipelineService.extractorFor(cfg),
                settings,
                new RunsRepo(db));
        ReportService reports = new ReportService(new ReportsRepo(db), pipeline.attributor());
        ProgressSink printer = p -> out.println(SearchLogFormatter.format(p));

        if (arg.containsKey("--submit")) {
            Report r = reports.submit(arg.get("--submit"), arg.get("--description"), arg.get("--reporter"),
                    null, null, arg.containsKey("--auto") ? ReportSource.AUTO_MONITOR : ReportSource.PUBLIC);
            out.println("[Report] submitted id=" + r.id() + " | post=" + (r.hasPostId() ? r.postId() : "N/A"));
        } else if (arg.containsKey("--investigate")) {
            Corpus corpus = pipeline.loadCorpus(new RunConfig(null, QuerySpec.between(null, to),
                    KeywordSet.empty(), Optional.empty(), null, cfg.analysis.topK));
            out.println("[Report] investigating " + arg.get("--investigate") + " over " + corpus.size() + " posts");
            printReport(out, reports.investigate(arg.get("--investigate"), corpus, printer));
        } else if (arg.containsKey("--cancel")) {
            CancelReason reason = CancelReason.fromWire(arg.getOrDefault("--reason", "not_violation"));
            printReport(out, reports.cancel(arg.get("--cancel"), reason));
        } else if (arg.containsKey("--reports")) {
            Optional<ReportStatus> status = Optional.ofNullable(arg.get("--status")).map(ReportStatus::fromWire);
            for (Report r : reports.list(status)) printReport(out, r);
            ReportStatistics s = reports.statistics();
            out.println("[Reports] total=" + s.total() + " | pending=" + s.pending() + " | active=" + s.active()
                    + " | resolved=" + s.resolved() + " | cancelled=" + s.cancelled());
        } else {
            analyze(arg, cfg, pipeline, collections, to, printer, out);
        }
    }

    private static void analyze(Map<String, String> arg, AppConfig cfg, PipelineService pipeline, Path collections,
                                Instant to, ProgressSink printer, PrintStream out) {
        List<String> keywords = Arrays.stream(arg.getOrDefault("--keywords", "").split(","))
                .map(String::trim).filter(s -> !s.isBlank()).toList();
        String reported = arg.containsKey("--report") ? Report.extractPostId(arg.get("--report")) : null;
        Instant from = arg.containsKey("--from") ? Instant.parse(arg.get("--from")) : null;
        int topK = Integer.parseInt(arg.getOrDefault("--topK", String.valueOf(cfg.analysis.topK)));
        if (arg.containsKey("--report") && reported == null) {
            System.err.println("[Sarmad] cannot read a post id from " + arg.get("--report"));
        }

        out.println("[Sarmad] collections=" + collections
                + " | keywords=" + (keywords.isEmpty() ? "auto" : keywords)
                + " | report=" + (reported == null ? "N/A" : reported)
                + " | from=" + (from == null ? "N/A" : from)
                + " | to=" + (to == null ? "N/A" : to)
                + " | topK=" + topK);

        RunConfig run = new RunConfig(null, QuerySpec.between(null, to), KeywordSet.of(keywords),
                Optional.ofNullable(reported), from, topK);

        RunResult result;
        try (AnalysisRunner runner = new AnalysisRunner(pipeline)) {
            Future<RunResult> job = runner.submit(run, printer);
            Thread cancelOnExit = new Thread(() -> job.cancel(true), "sarmad-cancel");
            Runtime.getRuntime().addShutdownHook(cancelOnExit);
            try {
                result = job.get();
            } finally {
                removeHook(cancelOnExit);
            }
        } catch (CancellationException e) {
            out.println("[Sarmad] run cancelled");
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            out.println("[Sarmad] run interrupted");
            return;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw new IllegalStateException("analysis failed", cause);
        }

        printFingerprint(out, result.fingerprint());
        if (arg.containsKey("--volume")) printVolume(out, result.corpus());
        printResult(out, result.search());

        if (arg.containsKey("--csv")) {
            new TraceCsvExporter().write(result.search().path(), Path.of(arg.get("--csv")));
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("shutdown already in progress: {}", e.getMessage());
        }
    }

    private static void printReport(PrintStream out, Report r) {
        out.println("[Report] id=" + r.id() + " | status=" + r.status().wire() + " | post=" + r.postId()
                + " | source=" + (r.sourcePostId() == null ? "N/A" : r.sourcePostId())
                + (r.cancelReason() == null ? "" : " | reason=" + r.cancelReason().wire()));
    }

    private static void printFingerprint(PrintStream out, Fingerprint fp) {
        out.println("[Fingerprint] posts=" + fp.postsAnalyzed() + " | tokens=" + fp.totalTokens());
        out.println("[Fingerprint] keywords=" + fp.keywords());
        out.println("[Fingerprint] bigrams=" + fp.topBigrams());
        out.println("[Fingerprint] hashtags=" + FrequencyAnalyzer.top(fp.hashtagFrequency(), 5));
    }

    private static void printVolume(PrintStream out, Corpus corpus) {
        for (HourlyVolume v : VolumeHistogram.byHour(corpus)) {
            out.printf("[Volume] %02d:00 %d%n", v.hour(), v.count());
        }
    }

    private static void printResult(PrintStream out, SearchResult r) {
        if (!r.found()) {
            out.println("[Result] no source found (iterations=" + r.iterations() + ")");
            return;
        }
        Post p = r.source().orElseThrow();
        out.println("[Result] strategy=" + r.strategy() + " | iterations=" + r.iterations());
        out.println("[Result] source=" + p.id() + " | author=" + p.authorId()
                + " | at=" + p.createdAt() + " | media=" + p.hasMedia());
        out.println("[Result] text=" + p.text());
    }

    static Map<String, String> parse(String[] args) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String v = (i + 1 < args.length && !args[i + 1].startsWith("--")) ? args[++i] : "true";
                m.put(a, v);
            }
        }
        return m;
    }
}
