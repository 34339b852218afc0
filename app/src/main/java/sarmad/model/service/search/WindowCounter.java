package sarmad.model.service.search;

import sarmad.model.domain.Corpus;
import sarmad.model.domain.KeywordSet;
import sarmad.model.domain.Post;
import sarmad.model.domain.SearchWindow;

import java.util.ArrayList;
import java.util.List;

/**
 * Evidence for one window: posts created in {@code [low, high)} whose text contains a
 * keyword, or that carry media. A source post often precedes the crowd's vocabulary,
 * so any in-window media post counts as a candidate even without keywords.
 */
public class WindowCounter {

    public int count(Corpus corpus, KeywordSet keywords, SearchWindow window) {
        int n = 0;
        for (Post p : corpus.posts()) {
            if (window.contains(p.createdAt()) && matches(p, keywords)) n++;
        }
        return n;
    }

    public List<Post> collect(Corpus corpus, KeywordSet keywords, SearchWindow window) {
        List<Post> out = new ArrayList<>();
        for (Post p : corpus.posts()) {
            if (window.contains(p.createdAt()) && matches(p, keywords)) out.add(p);
        }
        return out;
    }

    /** In-window media posts whose text matches none of the keywords. */
    public List<Post> collectMediaOnly(Corpus corpus, KeywordSet keywords, SearchWindow window) {
        List<Post> out = new ArrayList<>();
        for (Post p : corpus.posts()) {
            if (p.hasMedia() && window.contains(p.createdAt()) && !keywords.matches(p.text())) out.add(p);
        }
        return out;
    }

    static boolean matches(Post p, KeywordSet keywords) {
        return p.hasMedia() || keywords.matches(p.text());
    }
}
