package sarmad.collector.core;

import sarmad.collector.config.CollectorConfig;
import sarmad.collector.sink.RecordSink;

public interface PlatformCollector {
    void collect(CollectorConfig cfg, RecordSink sink) throws Exception;
    String id();
}
