package sarmad.model.service.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sarmad.model.domain.RawPost;
import sarmad.util.TimeUtil;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads posts from a "drop-folder": every {@code *.jsonl} file under the collections
 * root, one JSON object per line, as written by the collector module.
 *
 * <p>Unparsable lines and unreadable files are logged and skipped. Lines whose
 * {@code created_at} falls outside the query window are dropped here, read with the same
 * formats preprocessing accepts; lines whose timestamp does not parse are passed on so
 * preprocessing can reject them.
 */
public class FileConnector implements SocialConnector {
    private static final Logger log = LoggerFactory.getLogger(FileConnector.class);

    private final Path collectionsRoot;
    private final ObjectMapper mapper = new ObjectMapper();

    public FileConnector(Path collectionsRoot) {
        this.collectionsRoot = collectionsRoot;
    }

    @Override public String id() { return "file"; }

    @Override
    public Stream<RawPost> fetch(QuerySpec spec) {
        if (collectionsRoot == null || !Files.isDirectory(collectionsRoot)) {
            log.warn("collections root not found: {}", collectionsRoot);
            return Stream.empty();
        }
        QuerySpec q = spec == null ? QuerySpec.all() : spec;

        List<Path> files;
        try (Stream<Path> walk = Files.walk(collectionsRoot)) {
            files = walk.filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(".jsonl"))
                        .sorted()
                        .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("walk failed: " + collectionsRoot, e);
        }

        List<RawPost> out = new ArrayList<>();
        int lines = 0, skipped = 0;
        for (Path f : files) {
            log.debug("reading {}", f);
            try (BufferedReader br = Files.newBufferedReader(f, StandardCharsets.UTF_8)) {
                String line;
                int lineNo = 0;
                while ((line = br.readLine()) != null) {
                    lineNo++;
                    if (line.isBlank()) continue;
                    lines++;
                    RawPost rp = parseLine(line, f, lineNo);
                    if (rp == null) { skipped++; continue; }
                    if (!q.accepts(TimeUtil.parseInstant(rp.createdAt()).orElse(null))) continue;
                    out.add(rp);
                }
            } catch (IOException e) {
                log.warn("read failed: {} | {}", f, e.getMessage());
            }
        }
        log.info("files={} lines={} skipped={} result={} root={}",
                files.size(), lines, skipped, out.size(), collectionsRoot.toAbsolutePath());
        return out.stream();
    }

    RawPost parseLine(String line, Path file, int lineNo) {
        JsonNode n;
        try {
            n = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("bad json at {}:{} | {}", file.getFileName(), lineNo, e.getOriginalMessage());
            return null;
        }
        if (n == null || !n.isObject()) {
            log.warn("not an object at {}:{}", file.getFileName(), lineNo);
            return null;
        }

        String id = text(n, "id");
        String conversationId = text(n, "conversation_id");
        String authorId = text(n, "author_id");
        JsonNode author = n.get("author");
        if (authorId == null && author != null) authorId = text(author, "id");

        JsonNode media = n.get("media");
        boolean hasMedia = (media != null && media.isArray() && media.size() > 0)
                || n.path("has_media").asBoolean(false);

        Map<String, Object> meta = new LinkedHashMap<>();
        if (author != null) putIfPresent(meta, "username", text(author, "username"));
        putIfPresent(meta, "type", text(n, "type"));
        putIfPresent(meta, "in_reply_to_user_id", text(n, "in_reply_to_user_id"));
        if (n.path("is_source").asBoolean(false)) meta.put("is_source", Boolean.TRUE);
        meta.put("file", file.getFileName().toString());

        return new RawPost(id, conversationId, authorId, text(n, "text"), text(n, "created_at"), hasMedia, meta);
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText();
        return s.isBlank() ? null : s;
    }

    private static void putIfPresent(Map<String, Object> m, String k, String v) {
        if (v != null) m.put(k, v);
    }
}
