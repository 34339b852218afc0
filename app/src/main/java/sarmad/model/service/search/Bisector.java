package sarmad.model.service.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sarmad.model.domain.*;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CancellationException;

/**
 * Temporal bisection towards the earliest matching post.
 *
 * <p>Starts from the corpus span padded on both sides, then repeatedly counts matches in
 * the left half {@code [low, mid)}: any match moves {@code high} to {@code mid}, none moves
 * {@code low} to {@code mid}. The earliest match therefore never leaves the window. Stops at
 * the minimum window width or the iteration cap, whichever comes first; the earliest
 * candidate left in the final window is the attributed source.
 *
 * <p>A run stops with {@link CancellationException} as soon as its thread is interrupted,
 * before scanning again and without emitting further progress.
 */
public class Bisector {
    private static final Logger log = LoggerFactory.getLogger(Bisector.class);

    static final Comparator<Post> EARLIEST_FIRST =
            Comparator.comparing(Post::createdAt).thenComparing(Post::id);

    private final WindowCounter counter;
    private final SearchSettings settings;

    public Bisector() { this(new WindowCounter(), SearchSettings.defaults()); }

    public Bisector(WindowCounter counter, SearchSettings settings) {
        this.counter = Objects.requireNonNull(counter, "counter");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public SearchSettings settings() { return settings; }

    public SearchResult search(Corpus corpus, KeywordSet keywords) {
        return search(corpus, keywords, ProgressSink.none());
    }

    public SearchResult search(Corpus corpus, KeywordSet keywords, ProgressSink sink) {
        if (corpus == null || corpus.isEmpty()) return SearchResult.notFound();
        KeywordSet kws = keywords == null ? KeywordSet.empty() : keywords;
        ProgressSink out = sink == null ? ProgressSink.none() : sink;

        Instant low = corpus.earliest().orElseThrow().minus(settings.padding());
        Instant high = corpus.latest().orElseThrow().plus(settings.padding());
        if (!low.isBefore(high)) high = low.plus(settings.minWindow());

        List<SearchProgress> path = new ArrayList<>();
        int iteration = 0;

        while (Duration.between(low, high).compareTo(settings.minWindow()) > 0
                && iteration < settings.iterationCap()) {
            checkCancelled(iteration);
            iteration++;

            SearchWindow window = new SearchWindow(low, high);
            Instant mid = window.midpoint();
            int count = counter.count(corpus, kws, window.leftHalf());

            Decision decision;
            if (count > 0) {
                high = mid;
                decision = Decision.LEFT;
            } else {
                low = mid;
                decision = Decision.RIGHT;
            }

            SearchProgress step = new SearchProgress(iteration, low, mid, high, count, decision, window.duration());
            path.add(step);
            publish(out, step);
            pause(iteration);
        }
        checkCancelled(iteration);

        SearchWindow last = new SearchWindow(low, high);
        Map<String, Post> candidates = new LinkedHashMap<>();
        for (Post p : counter.collect(corpus, kws, last)) candidates.putIfAbsent(p.id(), p);
        for (Post p : counter.collectMediaOnly(corpus, kws, last)) candidates.putIfAbsent(p.id(), p);

        Optional<Post> source = candidates.values().stream().min(EARLIEST_FIRST);
        log.debug("bisection done: iterations={} window=[{}, {}) candidates={} source={}",
                iteration, low, high, candidates.size(), source.map(Post::id).orElse("-"));

        return new SearchResult(source.isPresent(), source, iteration, Optional.of(last), path,
                source.isPresent() ? Strategy.TEMPORAL_BISECTION : Strategy.NONE);
    }

    static void publish(ProgressSink sink, SearchProgress step) {
        try {
            sink.onProgress(step);
        } catch (Exception e) {
            log.warn("progress sink failed at iteration {}: {}", step.iteration(), e.toString());
        }
    }

    private void pause(int iteration) {
        if (settings.pacing().isZero()) return;
        try {
            Thread.sleep(settings.pacing().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("search cancelled during pacing after iteration " + iteration);
        }
    }

    private static void checkCancelled(int iteration) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("search cancelled after iteration " + iteration);
        }
    }
}
