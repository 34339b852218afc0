package sarmad.collector.sink;

import sarmad.collector.model.RawRecord;

public interface RecordSink {
    void accept(RawRecord r) throws Exception;
}
