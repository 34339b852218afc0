package sarmad.model.service.nlp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Loads {@code stopwords.txt} and {@code denylist.txt} (one term per line, {@code #} comments)
 * from a directory, falling back per file to the bundled {@code lexicons/ar/} resources.
 */
public final class LexiconLoader {
    private static final Logger log = LoggerFactory.getLogger(LexiconLoader.class);

    public static final String STOPWORDS_FILE = "stopwords.txt";
    public static final String DENYLIST_FILE = "denylist.txt";
    private static final String BUNDLED_ROOT = "lexicons/ar/";

    private LexiconLoader() {}

    public static Lexicon load(Path dir) {
        Set<String> stop = readFileOrBundled(dir, STOPWORDS_FILE);
        Set<String> deny = readFileOrBundled(dir, DENYLIST_FILE);
        log.info("lexicon loaded: stop={} deny={} from={}", stop.size(), deny.size(),
                dir == null ? "classpath:" + BUNDLED_ROOT : dir.toAbsolutePath());
        return new Lexicon(stop, deny);
    }

    /** The bundled Gulf-Arabic lists. */
    public static Lexicon bundled() { return load(null); }

    private static Set<String> readFileOrBundled(Path dir, String name) {
        if (dir != null) {
            Path f = dir.resolve(name);
            if (Files.isRegularFile(f)) {
                try (BufferedReader br = Files.newBufferedReader(f, StandardCharsets.UTF_8)) {
                    return readTerms(br);
                } catch (IOException e) {
                    throw new UncheckedIOException("cannot read lexicon file " + f, e);
                }
            }
            log.debug("{} not found in {}, using bundled list", name, dir);
        }
        try (InputStream in = LexiconLoader.class.getClassLoader().getResourceAsStream(BUNDLED_ROOT + name)) {
            if (in == null) {
                log.warn("bundled lexicon {} missing from classpath", BUNDLED_ROOT + name);
                return Set.of();
            }
            return readTerms(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read bundled lexicon " + name, e);
        }
    }

    static Set<String> readTerms(BufferedReader br) throws IOException {
        Set<String> out = new LinkedHashSet<>();
        String line;
        while ((line = br.readLine()) != null) {
            String t = line.strip();
            if (t.isEmpty() || t.startsWith("#")) continue;
            out.add(t.toLowerCase(Locale.ROOT));
        }
        return out;
    }
}
