package sarmad.model.service.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import sarmad.model.service.search.SearchSettings;

import java.io.File;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

public class AppConfig {
    public final Analysis analysis;
    public final Data data;

    private AppConfig(Analysis analysis, Data data) {
        this.analysis = analysis;
        this.data = data;
    }

    public static AppConfig load() {
        File f = new File("config/app.conf");
        Config root = f.exists() ? ConfigFactory.parseFile(f).withFallback(ConfigFactory.load()).resolve()
                                 : ConfigFactory.load(); // fallback classpath
        return from(root);
    }

    public static AppConfig from(Config root) {
        Config a = root.getConfig("sarmad.analysis");
        String lexiconDir = a.hasPath("lexicon.dir") ? a.getString("lexicon.dir") : "";
        Analysis analysis = new Analysis(
                a.getInt("topK"),
                a.getInt("iterationCap"),
                a.getDuration("minWindow"),
                a.getDuration("windowPadding"),
                a.getDuration("pacing"),
                lexiconDir
        );
        Config d = root.getConfig("sarmad.data");
        Data data = new Data(d.getString("collections"), d.getString("db"));
        return new AppConfig(analysis, data);
    }

    public SearchSettings searchSettings() {
        return new SearchSettings(analysis.iterationCap, analysis.minWindow, analysis.windowPadding, analysis.pacing);
    }

    /** Configured lexicon directory; empty means the bundled lists. */
    public Optional<Path> lexiconDir() {
        return analysis.lexiconDir.isBlank() ? Optional.empty() : Optional.of(Path.of(analysis.lexiconDir));
    }

    public Path collectionsRoot() { return Path.of(data.collections); }
    public Path dbPath() { return Path.of(data.db); }

    public static class Analysis {
        public final int topK;
        public final int iterationCap;
        public final Duration minWindow;
        public final Duration windowPadding;
        public final Duration pacing;
        public final String lexiconDir;
        public Analysis(int topK, int iterationCap, Duration minWindow, Duration windowPadding,
                        Duration pacing, String lexiconDir) {
            this.topK = topK; this.iterationCap = iterationCap; this.minWindow = minWindow;
            this.windowPadding = windowPadding; this.pacing = pacing; this.lexiconDir = lexiconDir;
        }
    }

    public static class Data {
        public final String collections;
        public final String db;
        public Data(String collections, String db) { this.collections = collections; this.db = db; }
    }
}
