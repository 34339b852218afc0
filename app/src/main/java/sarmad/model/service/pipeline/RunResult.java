package sarmad.model.service.pipeline;

import sarmad.model.domain.Corpus;
import sarmad.model.domain.Fingerprint;
import sarmad.model.domain.SearchResult;

public record RunResult(RunSummary summary, Fingerprint fingerprint, SearchResult search, Corpus corpus) {}
