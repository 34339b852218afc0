package sarmad.model.service.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sarmad.model.domain.*;
import sarmad.model.service.nlp.FingerprintExtractor;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Source attribution: reply-thread tracing first, temporal bisection as fallback.
 * <ol>
 *   <li>reported post found in corpus: its conversation root is the source</li>
 *   <li>otherwise: bisect with the supplied keywords, or freshly extracted ones</li>
 *   <li>no root and no usable keywords: not found</li>
 * </ol>
 */
public class Attributor {
    private static final Logger log = LoggerFactory.getLogger(Attributor.class);

    private final ConversationTracer tracer;
    private final Bisector bisector;
    private final FingerprintExtractor extractor;

    public Attributor(ConversationTracer tracer, Bisector bisector, FingerprintExtractor extractor) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.bisector = Objects.requireNonNull(bisector, "bisector");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    public SearchResult attribute(Corpus corpus, AttributionRequest request) {
        return attribute(corpus, request, ProgressSink.none());
    }

    public SearchResult attribute(Corpus corpus, AttributionRequest request, ProgressSink sink) {
        if (corpus == null || corpus.isEmpty()) return SearchResult.notFound();
        ProgressSink out = sink == null ? ProgressSink.none() : sink;

        Optional<Post> reported = request.reportedPostId().flatMap(corpus::findById);
        if (request.reportedPostId().isPresent() && reported.isEmpty()) {
            log.debug("reported post {} not in corpus, skipping conversation trace", request.reportedPostId().get());
        }
        if (reported.isPresent()) {
            String conversationId = reported.get().conversationId();
            Optional<Post> root = tracer.findRoot(corpus, conversationId);
            if (root.isPresent()) {
                int threadSize = tracer.thread(corpus, conversationId).size();
                Post r = root.get();
                SearchProgress step = new SearchProgress(1, r.createdAt(), r.createdAt(), r.createdAt(),
                        threadSize, Decision.TRACE_CONVERSATION, Duration.ZERO);
                Bisector.publish(out, step);
                log.info("conversation {} traced to root {} ({} posts)", conversationId, r.id(), threadSize);
                return new SearchResult(true, root, 1, Optional.empty(), List.of(step), Strategy.TRACE_CONVERSATION);
            }
        }

        KeywordSet keywords = request.keywords()
                .filter(k -> !k.isEmpty())
                .orElseGet(() -> extractor.extract(corpus).keywords());
        if (keywords.isEmpty()) {
            log.info("no keywords available for bisection; source not found");
            return SearchResult.notFound();
        }
        return bisector.search(corpus, keywords, out);
    }
}
