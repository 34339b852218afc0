package sarmad.model.service.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sarmad.model.domain.*;
import sarmad.model.repository.ReportsRepo;
import sarmad.model.service.export.ResultJson;
import sarmad.model.service.search.AttributionRequest;
import sarmad.model.service.search.Attributor;
import sarmad.model.service.search.LoggingProgressSink;
import sarmad.model.service.search.ProgressSink;

import java.util.List;
import java.util.Optional;

/**
 * Report lifecycle: pending on submit, active while investigated, then resolved with the
 * attributed source or back to pending when none is found. Cancelling is terminal.
 */
public class ReportService {
    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    private final ReportsRepo repo;
    private final Attributor attributor;

    public ReportService(ReportsRepo repo, Attributor attributor) {
        this.repo = repo;
        this.attributor = attributor;
    }

    public Report submit(String postUrl, String description, String reporterName,
                         String reporterPhone, String reporterId, ReportSource source) {
        if (postUrl == null || postUrl.isBlank()) throw new IllegalArgumentException("postUrl is required");
        Report r = repo.create(Report.create(postUrl, description, reporterName, reporterPhone, reporterId, source));
        log.info("report {} submitted for post {} ({})", r.id(), r.hasPostId() ? r.postId() : "?", r.source().wire());
        return r;
    }

    public Report investigate(String reportId, Corpus corpus) {
        return investigate(reportId, corpus, new LoggingProgressSink());
    }

    public Report investigate(String reportId, Corpus corpus, ProgressSink sink) {
        Report r = require(reportId);
        if (r.status() == ReportStatus.RESOLVED || r.status() == ReportStatus.CANCELLED) {
            throw new IllegalStateException("report " + reportId + " is already " + r.status().wire());
        }
        repo.activate(reportId);

        SearchResult result;
        try {
            result = attributor.attribute(corpus, AttributionRequest.forReport(r.postId()), sink);
        } catch (RuntimeException e) {
            repo.updateStatus(reportId, ReportStatus.PENDING);
            throw e;
        }

        if (result.found()) {
            String sourceId = result.source().map(Post::id).orElseThrow();
            repo.resolve(reportId, sourceId, ResultJson.toJson(result));
            log.info("report {} resolved: source={} via {}", reportId, sourceId, result.strategy());
        } else {
            repo.updateStatus(reportId, ReportStatus.PENDING);
            log.info("report {} left pending: no source found", reportId);
        }
        return require(reportId);
    }

    public Report cancel(String reportId, CancelReason reason) {
        Report r = require(reportId);
        if (r.status() == ReportStatus.RESOLVED) {
            throw new IllegalStateException("report " + reportId + " is already resolved");
        }
        repo.cancel(reportId, reason);
        return require(reportId);
    }

    public Optional<Report> find(String reportId) { return repo.findById(reportId); }

    public List<Report> list(Optional<ReportStatus> status) { return repo.findAll(status); }

    public ReportStatistics statistics() { return repo.statistics(); }

    private Report require(String reportId) {
        return repo.findById(reportId)
                .orElseThrow(() -> new IllegalArgumentException("unknown report: " + reportId));
    }
}
