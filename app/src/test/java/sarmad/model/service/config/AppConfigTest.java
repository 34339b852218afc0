package sarmad.model.service.config;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;
import sarmad.model.service.search.SearchSettings;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    void referenceDefaultsMatchSearchDefaults() {
        AppConfig cfg = AppConfig.from(ConfigFactory.load());

        assertEquals(3, cfg.analysis.topK);
        assertEquals(SearchSettings.defaults(), cfg.searchSettings());
        assertEquals(Path.of("data/collections"), cfg.collectionsRoot());
    }

    @Test
    void overridesTakePrecedence() {
        AppConfig cfg = AppConfig.from(ConfigFactory.parseString(
                        "sarmad.analysis { topK = 5, pacing = 250ms, windowPadding = 10m, lexicon.dir = \"/opt/lex\" }")
                .withFallback(ConfigFactory.load()).resolve());

        assertEquals(5, cfg.analysis.topK);
        assertEquals(Duration.ofMillis(250), cfg.searchSettings().pacing());
        assertEquals(Duration.ofMinutes(10), cfg.searchSettings().padding());
        assertEquals(Path.of("/opt/lex"), cfg.lexiconDir().orElseThrow());
    }
}
