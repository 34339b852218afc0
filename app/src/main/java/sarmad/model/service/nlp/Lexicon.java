package sarmad.model.service.nlp;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Word lists for one dialect: stop-words dropped during tokenization and
 * generic high-frequency terms that may not become keywords. Terms are held lower-cased.
 */
public record Lexicon(Set<String> stopWords, Set<String> denylist) {
    public Lexicon {
        stopWords = normalize(stopWords);
        denylist = normalize(denylist);
    }

    public static Lexicon empty() { return new Lexicon(Set.of(), Set.of()); }

    private static Set<String> normalize(Set<String> terms) {
        if (terms == null) return Set.of();
        return terms.stream()
                .map(t -> t.strip().toLowerCase(Locale.ROOT))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }
}
