package sarmad.model.service.nlp;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips URLs and mentions, then splits on whitespace and Arabic/Latin punctuation.
 * Hashtags stay in the token stream with their marker; {@link #hashtags(String)}
 * reports them separately without it.
 */
public class Tokenizer {

    private static final Pattern URL = Pattern.compile("(?i)\\bhttps?://\\S+");
    private static final Pattern MENTION = Pattern.compile("@\\w+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern HASHTAG = Pattern.compile("(?<!\\w)#(\\w+)", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SPLIT = Pattern.compile("[\\s،.!؟?:؛…\\-_()\\[\\]«»\"',]+");

    /** Text with URLs and mentions removed. */
    public String clean(String text) {
        if (text == null || text.isEmpty()) return "";
        String cleaned = URL.matcher(text).replaceAll(" ");
        cleaned = MENTION.matcher(cleaned).replaceAll(" ");
        return cleaned.strip();
    }

    /** Tokens longer than one character. */
    public List<String> tokenize(String text) {
        String cleaned = clean(text);
        if (cleaned.isEmpty()) return List.of();
        List<String> out = new ArrayList<>();
        for (String raw : SPLIT.split(cleaned)) {
            String t = raw.strip();
            if (t.codePointCount(0, t.length()) > 1) out.add(t);
        }
        return out;
    }

    /** Hashtags in order of appearance, marker stripped. */
    public List<String> hashtags(String text) {
        String cleaned = clean(text);
        if (cleaned.isEmpty()) return List.of();
        List<String> out = new ArrayList<>();
        Matcher m = HASHTAG.matcher(cleaned);
        while (m.find()) out.add(m.group(1));
        return out;
    }
}
