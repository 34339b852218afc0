package sarmad.collector.sink;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Small descriptor written next to each collection file. */
public final class DatasetYaml {
    private DatasetYaml() {}

    public static void write(Path yaml, String dataFileName, int records, List<String> keywords) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(yaml, StandardCharsets.UTF_8)) {
            w.write("version: 1\n");
            w.write("name: " + dataFileName.replace('"', '-') + "\n");
            w.write("files:\n");
            w.write("  - path: " + dataFileName + "\n");
            w.write("    format: jsonl\n");
            w.write("    records: " + records + "\n");
            w.write("keywords:\n");
            for (String k : keywords) {
                w.write("  - \"" + k.replace("\"", "\\\"") + "\"\n");
            }
        }
    }
}
