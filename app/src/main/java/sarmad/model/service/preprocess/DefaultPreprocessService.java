package sarmad.model.service.preprocess;

import sarmad.model.domain.Post;
import sarmad.model.domain.RawPost;
import sarmad.util.TimeUtil;

import java.time.Instant;
import java.util.regex.Pattern;

public class DefaultPreprocessService implements PreprocessService {

    private static final Pattern CONTROL = Pattern.compile("[\\p{Cc}&&[^\\n\\t]]");

    @Override
    public Post preprocess(RawPost raw) {
        if (raw == null) throw new MalformedPostException(null, "null record");
        String id = raw.id();
        if (id == null || id.isBlank()) {
            throw new MalformedPostException(id, "missing post id");
        }
        Instant ts = TimeUtil.parseInstant(raw.createdAt())
                .orElseThrow(() -> new MalformedPostException(id, "unparsable created_at: " + raw.createdAt()));

        String text = raw.text() == null ? "" : CONTROL.matcher(raw.text()).replaceAll(" ").strip();
        String conversationId = raw.conversationId() == null ? null : raw.conversationId().strip();

        return new Post(id.strip(), conversationId, raw.authorId(), text, ts, raw.hasMedia());
    }
}
