package sarmad.model.service.search;

import sarmad.model.domain.Corpus;
import sarmad.model.domain.Post;

import java.util.List;
import java.util.Optional;

/** Finds the structural origin of a reply thread: its earliest post. */
public class ConversationTracer {

    public Optional<Post> findRoot(Corpus corpus, String conversationId) {
        if (corpus == null || conversationId == null) return Optional.empty();
        return corpus.posts().stream()
                .filter(p -> conversationId.equals(p.conversationId()))
                .min(Bisector.EARLIEST_FIRST);
    }

    /** Every post of the conversation, earliest first. */
    public List<Post> thread(Corpus corpus, String conversationId) {
        if (corpus == null || conversationId == null) return List.of();
        return corpus.posts().stream()
                .filter(p -> conversationId.equals(p.conversationId()))
                .sorted(Bisector.EARLIEST_FIRST)
                .toList();
    }
}
