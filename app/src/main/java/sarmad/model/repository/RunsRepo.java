package sarmad.model.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import sarmad.model.domain.Strategy;
import sarmad.model.service.pipeline.RunSummary;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class RunsRepo {
    private final SQLite db;
    private final ObjectMapper om = new ObjectMapper();

    public RunsRepo(SQLite db) { this.db = db; }

    public void saveRun(RunSummary run) {
        String sql = "INSERT OR REPLACE INTO runs(run_id, started_at, finished_at, found, source_post_id, "
                + "strategy, iterations, params_json) VALUES(?,?,?,?,?,?,?,?)";
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("keywords", run.keywords());
        params.put("ingested", run.ingested());
        params.put("skipped", run.skipped());
        try (Connection con = db.connect(); PreparedStatement ps = con.prepareStatement(sql)) {
            ps.setString(1, run.runId());
            ps.setString(2, run.startedAt().toString());
            ps.setString(3, run.finishedAt().toString());
            ps.setInt(4, run.found() ? 1 : 0);
            ps.setString(5, run.sourcePostId());
            ps.setString(6, run.strategy().name());
            ps.setInt(7, run.iterations());
            ps.setString(8, om.writeValueAsString(params));
            ps.executeUpdate();
        } catch (SQLException | JsonProcessingException e) { throw new RuntimeException(e); }
    }

    public List<RunSummary> listRunsOrderByStartedDesc(int limit) {
        String sql = "SELECT run_id, started_at, finished_at, found, source_post_id, strategy, iterations, params_json "
                + "FROM runs ORDER BY started_at DESC LIMIT ?";
        List<RunSummary> out = new ArrayList<>();
        try (Connection con = db.connect(); PreparedStatement ps = con.prepareStatement(sql)) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Params p = om.readValue(rs.getString("params_json"), Params.class);
                    out.add(new RunSummary(
                            rs.getString("run_id"),
                            Instant.parse(rs.getString("started_at")),
                            Instant.parse(rs.getString("finished_at")),
                            p.ingested, p.skipped,
                            p.keywords == null ? List.of() : p.keywords,
                            rs.getInt("found") == 1,
                            rs.getString("source_post_id"),
                            rs.getInt("iterations"),
                            Strategy.valueOf(rs.getString("strategy"))));
                }
            }
        } catch (SQLException | JsonProcessingException e) { throw new RuntimeException(e); }
        return out;
    }

    static class Params {
        public List<String> keywords;
        public int ingested;
        public int skipped;
    }
}
