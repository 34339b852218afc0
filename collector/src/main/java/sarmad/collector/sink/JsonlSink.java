package sarmad.collector.sink;

import com.google.gson.*;
import sarmad.collector.model.RawRecord;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/** One JSON object per line, UTF-8, file truncated on open. */
public final class JsonlSink implements RecordSink, Closeable {
    static final Gson GSON = new GsonBuilder()
            .disableHtmlEscaping()
            .registerTypeAdapter(Instant.class, (JsonSerializer<Instant>) (src, t, ctx) ->
                    src == null ? JsonNull.INSTANCE : new JsonPrimitive(src.toString()))
            .registerTypeAdapter(Instant.class, (JsonDeserializer<Instant>) (json, t, ctx) ->
                    json == null || json.isJsonNull() ? null : Instant.parse(json.getAsString()))
            .create();

    private final Path file;
    private final BufferedWriter w;
    private int written;

    public JsonlSink(Path file) throws IOException {
        this.file = file;
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        this.w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
    }

    @Override public void accept(RawRecord r) throws IOException {
        w.write(GSON.toJson(r));
        w.newLine();
        written++;
    }

    public Path path() { return file; }
    public int written() { return written; }

    @Override public void close() throws IOException { w.close(); }

    public static RawRecord parse(String line) {
        return GSON.fromJson(line, RawRecord.class);
    }
}
