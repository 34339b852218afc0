package sarmad.model.service.search;

import sarmad.model.domain.SearchProgress;

/**
 * Receives search steps in iteration order, before the next step starts.
 * Exceptions thrown here are logged by the caller and never abort a search.
 */
@FunctionalInterface
public interface ProgressSink {
    void onProgress(SearchProgress progress) throws Exception;

    static ProgressSink none() { return p -> {}; }
}
