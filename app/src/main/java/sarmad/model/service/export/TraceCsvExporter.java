package sarmad.model.service.export;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sarmad.model.domain.SearchProgress;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Writes a search path as CSV, one row per iteration. An existing file is replaced. */
public class TraceCsvExporter {
    private static final Logger log = LoggerFactory.getLogger(TraceCsvExporter.class);

    static final String[] HEADERS = {"iteration", "low", "mid", "high", "count", "decision", "window_minutes"};

    public void write(List<SearchProgress> path, Path file) {
        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                write(path, writer);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("csv export failed: " + file, e);
        }
        log.info("wrote {} rows to {}", path.size(), file);
    }

    public void write(List<SearchProgress> path, Appendable out) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(HEADERS).build();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (SearchProgress p : path) {
                printer.printRecord(p.iteration(), p.low(), p.mid(), p.high(), p.countInRange(),
                        p.decision().label(), p.windowSizeMinutes());
            }
            printer.flush();
        }
    }
}
