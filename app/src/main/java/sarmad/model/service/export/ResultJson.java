package sarmad.model.service.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import sarmad.model.domain.KeywordSet;
import sarmad.model.domain.Post;
import sarmad.model.domain.SearchProgress;
import sarmad.model.domain.SearchResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Compact JSON summary of an attribution, stored with resolved reports. */
public final class ResultJson {
    private static final ObjectMapper OM = new ObjectMapper();

    private ResultJson() {}

    public static String toJson(SearchResult result) {
        return toJson(result, null);
    }

    public static String toJson(SearchResult result, KeywordSet keywords) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("found", result.found());
        m.put("strategy", result.strategy().name().toLowerCase(Locale.ROOT));
        m.put("iterations", result.iterations());
        if (keywords != null) m.put("keywords", keywords.terms());
        result.source().ifPresent(p -> m.put("source", source(p)));
        result.finalWindow().ifPresent(w -> m.put("final_window",
                Map.of("low", w.low().toString(), "high", w.high().toString())));

        List<Map<String, Object>> steps = new ArrayList<>();
        for (SearchProgress p : result.path()) {
            Map<String, Object> s = new LinkedHashMap<>();
            s.put("iteration", p.iteration());
            s.put("low", p.low().toString());
            s.put("mid", p.mid().toString());
            s.put("high", p.high().toString());
            s.put("count", p.countInRange());
            s.put("decision", p.decision().label());
            s.put("window_minutes", p.windowSizeMinutes());
            steps.add(s);
        }
        m.put("path", steps);
        try {
            return OM.writeValueAsString(m);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialise search result", e);
        }
    }

    private static Map<String, Object> source(Post p) {
        Map<String, Object> s = new LinkedHashMap<>();
        s.put("id", p.id());
        s.put("conversation_id", p.conversationId());
        s.put("author_id", p.authorId());
        s.put("created_at", p.createdAt().toString());
        s.put("has_media", p.hasMedia());
        s.put("text", p.text());
        return s;
    }
}
