package sarmad.collector;

import sarmad.collector.config.CollectorConfig;
import sarmad.collector.core.CollectorRunner;
import sarmad.collector.core.PlatformCollector;

import java.nio.file.Path;

public final class Main {
    public static void main(String[] args) throws Exception {
        CollectorConfig cfg = CollectorConfig.fromArgs(args);
        var collectors = CollectorRunner.buildCollectors(cfg);
        System.out.println("[Collector] enabled: " + collectors.stream().map(PlatformCollector::id).toList()
                + " | base=" + cfg.base + " | location=" + cfg.location + " | seed=" + cfg.seed);
        Path out = CollectorRunner.runAll(cfg, collectors);
        System.out.println("[Collector] done: " + out);
    }
}
