package sarmad.collector.sink;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sarmad.collector.model.RawRecord;
import sarmad.collector.model.RawRecord.Author;
import sarmad.collector.model.RawRecord.Media;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonlSinkTest {

    private final Author fahad = new Author("u1", "fahad_99", "فهد");
    private final Instant t = Instant.parse("2024-05-01T14:15:00Z");

    @Test
    void writesSnakeCaseFieldsOnePerLine(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("a/b.jsonl");
        RawRecord source = new RawRecord("100", null, fahad, "المقطع كامل", t,
                List.of(new Media("video", "vid_1", "https://video.example.com/clip.mp4")), true, null, null);
        RawRecord reply = new RawRecord("101", "100", new Author("u2", "sara", "Sara"), "وين صار؟",
                t.plusSeconds(600), null, false, "reply", "u1");

        try (JsonlSink sink = new JsonlSink(file)) {
            sink.accept(source);
            sink.accept(reply);
            assertEquals(2, sink.written());
        }

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("المقطع كامل"));

        JsonObject first = JsonParser.parseString(lines.get(0)).getAsJsonObject();
        assertEquals("100", first.get("conversation_id").getAsString());
        assertEquals("u1", first.get("author_id").getAsString());
        assertEquals("fahad_99", first.getAsJsonObject("author").get("username").getAsString());
        assertEquals("2024-05-01T14:15:00Z", first.get("created_at").getAsString());
        assertTrue(first.get("is_source").getAsBoolean());
        assertFalse(first.has("type"));

        RawRecord back = JsonlSink.parse(lines.get(1));
        assertEquals("reply", back.type);
        assertEquals("u1", back.inReplyToUserId);
        assertEquals(t.plusSeconds(600), back.createdAt);
    }
}
