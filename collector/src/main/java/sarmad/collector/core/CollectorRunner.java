package sarmad.collector.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sarmad.collector.config.CollectorConfig;
import sarmad.collector.sink.DatasetYaml;
import sarmad.collector.sink.JsonlSink;
import sarmad.collector.sources.synthetic.SyntheticCollector;
import sarmad.collector.util.TimeUtil;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class CollectorRunner {
    private static final Logger log = LoggerFactory.getLogger(CollectorRunner.class);

    private CollectorRunner() {}

    /** Writes every collector's records into one JSONL file plus {@code dataset.yaml}; returns the JSONL path. */
    public static Path runAll(CollectorConfig cfg, List<PlatformCollector> collectors) throws Exception {
        Path colDir = cfg.outRoot.resolve(cfg.collection);
        Files.createDirectories(colDir);
        String fileBase = TimeUtil.yearMonthDay(cfg.base) + "-collector.jsonl";
        Path jsonl = colDir.resolve(fileBase);
        Path yaml = colDir.resolve("dataset.yaml");

        int written;
        try (JsonlSink sink = new JsonlSink(jsonl)) {
            for (PlatformCollector c : collectors) {
                try {
                    c.collect(cfg, sink);
                } catch (Exception ex) {
                    log.warn("collector '{}' skipped: {}", c.id(), ex.getMessage());
                }
            }
            written = sink.written();
        }
        DatasetYaml.write(yaml, fileBase, written, cfg.keywords);
        log.info("wrote {} records to {} and {}", written, jsonl, yaml);
        return jsonl;
    }

    public static List<PlatformCollector> buildCollectors(CollectorConfig cfg) {
        return List.of(new SyntheticCollector());
    }
}
