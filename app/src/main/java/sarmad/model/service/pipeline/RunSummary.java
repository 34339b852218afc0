package sarmad.model.service.pipeline;

import sarmad.model.domain.Strategy;

import java.time.Instant;
import java.util.List;

public record RunSummary(
    String runId,
    Instant startedAt,
    Instant finishedAt,
    int ingested,
    int skipped,
    List<String> keywords,
    boolean found,
    String sourcePostId,
    int iterations,
    Strategy strategy
) {}
