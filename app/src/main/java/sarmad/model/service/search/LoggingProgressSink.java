package sarmad.model.service.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sarmad.model.domain.SearchProgress;

public class LoggingProgressSink implements ProgressSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingProgressSink.class);

    @Override
    public void onProgress(SearchProgress progress) {
        log.info(SearchLogFormatter.format(progress));
    }
}
