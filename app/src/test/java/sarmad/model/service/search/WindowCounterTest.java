package sarmad.model.service.search;

import org.junit.jupiter.api.Test;
import sarmad.model.domain.Corpus;
import sarmad.model.domain.KeywordSet;
import sarmad.model.domain.Post;
import sarmad.model.domain.SearchWindow;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static sarmad.model.Fixtures.*;

class WindowCounterTest {

    private final WindowCounter counter = new WindowCounter();
    private final KeywordSet keywords = KeywordSet.of("مضاربة");
    private final SearchWindow window = new SearchWindow(at("10:00"), at("11:00"));

    private final Post atLow = post("1", "مضاربة عند المدرسة", at("10:00"));
    private final Post atHigh = post("2", "مضاربة ثانية", at("11:00"));
    private final Post clip = media("3", "شوفوا", at("10:30"));
    private final Post chatter = post("4", "صباح الخير", at("10:15"));

    @Test
    void countsKeywordAndMediaPostsInHalfOpenWindow() {
        Corpus corpus = Corpus.of(atLow, atHigh, clip, chatter);

        assertEquals(2, counter.count(corpus, keywords, window));
        assertEquals(List.of(atLow, clip), counter.collect(corpus, keywords, window));
    }

    @Test
    void togglingMediaChangesCountByOne() {
        List<Post> posts = new ArrayList<>(List.of(atLow, atHigh, clip, chatter));
        int before = counter.count(Corpus.of(posts), keywords, window);

        posts.set(3, chatter.withMedia(true));
        assertEquals(before + 1, counter.count(Corpus.of(posts), keywords, window));

        posts.set(3, chatter);
        posts.set(2, clip.withMedia(false));
        assertEquals(before - 1, counter.count(Corpus.of(posts), keywords, window));
    }

    @Test
    void mediaOnlyExcludesKeywordMatches() {
        Post keywordClip = media("5", "مضاربة بالفيديو", at("10:40"));
        Corpus corpus = Corpus.of(atLow, clip, keywordClip, chatter);

        assertEquals(List.of(clip), counter.collectMediaOnly(corpus, keywords, window));
    }

    @Test
    void emptyKeywordsStillCountMedia() {
        Corpus corpus = Corpus.of(atLow, clip, chatter);

        assertEquals(1, counter.count(corpus, KeywordSet.empty(), window));
    }
}
