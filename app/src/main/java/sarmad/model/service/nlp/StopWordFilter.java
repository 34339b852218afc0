package sarmad.model.service.nlp;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Drops tokens present in a closed stop-word set (case-insensitive for Latin script). */
public class StopWordFilter {
    private final Set<String> stopWords;

    public StopWordFilter(Set<String> stopWords) {
        this.stopWords = stopWords == null ? Set.of() : Set.copyOf(stopWords);
    }

    public boolean isStopWord(String token) {
        return token != null && stopWords.contains(token.toLowerCase(Locale.ROOT));
    }

    public List<String> filter(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) return List.of();
        return tokens.stream().filter(t -> !isStopWord(t)).toList();
    }
}
