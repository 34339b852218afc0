package sarmad.model.service.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sarmad.model.service.search.ProgressSink;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs pipeline jobs off the caller's thread. {@code future.cancel(true)} interrupts the
 * worker, which stops the search at its next check.
 */
public class AnalysisRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AnalysisRunner.class);

    private final PipelineService pipeline;
    private final ExecutorService executor;

    public AnalysisRunner(PipelineService pipeline) {
        this(pipeline, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "sarmad-analysis");
            t.setDaemon(true);
            return t;
        }));
    }

    public AnalysisRunner(PipelineService pipeline, ExecutorService executor) {
        this.pipeline = pipeline;
        this.executor = executor;
    }

    public Future<RunResult> submit(RunConfig cfg, ProgressSink sink) {
        return executor.submit(() -> {
            try {
                return pipeline.run(cfg, sink);
            } catch (CancellationException e) {
                log.info("[{}] cancelled: {}", cfg.runId(), e.getMessage());
                throw e;
            }
        });
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("analysis executor did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
