package sarmad.model.domain;

import java.util.List;
import java.util.Optional;

public record SearchResult(
    boolean found,
    Optional<Post> source,
    int iterations,
    Optional<SearchWindow> finalWindow,
    List<SearchProgress> path,
    Strategy strategy
) {
    public SearchResult {
        source = source == null ? Optional.empty() : source;
        finalWindow = finalWindow == null ? Optional.empty() : finalWindow;
        path = path == null ? List.of() : List.copyOf(path);
    }

    public static SearchResult notFound() {
        return new SearchResult(false, Optional.empty(), 0, Optional.empty(), List.of(), Strategy.NONE);
    }
}
