package sarmad.model.repository;

import sarmad.model.domain.*;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ReportsRepo {
    private static final String COLUMNS =
            "id, post_url, post_id, description, status, source, reporter_name, reporter_phone, reporter_id, "
            + "created_at, updated_at, resolved_at, cancel_reason, source_post_id, analysis_json";

    private final SQLite db;

    public ReportsRepo(SQLite db) { this.db = db; }

    public Report create(Report r) {
        String sql = "INSERT INTO reports(" + COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection con = db.connect(); PreparedStatement ps = con.prepareStatement(sql)) {
            ps.setString(1, r.id());
            ps.setString(2, r.postUrl());
            ps.setString(3, r.postId());
            ps.setString(4, r.description());
            ps.setString(5, r.status().wire());
            ps.setString(6, r.source().wire());
            ps.setString(7, r.reporterName());
            ps.setString(8, r.reporterPhone());
            ps.setString(9, r.reporterId());
            ps.setString(10, r.createdAt().toString());
            ps.setString(11, r.updatedAt().toString());
            ps.setString(12, r.resolvedAt() == null ? null : r.resolvedAt().toString());
            ps.setString(13, r.cancelReason() == null ? null : r.cancelReason().wire());
            ps.setString(14, r.sourcePostId());
            ps.setString(15, r.analysisJson());
            ps.executeUpdate();
            return r;
        } catch (SQLException e) { throw new RuntimeException(e); }
    }

    public Optional<Report> findById(String id) {
        String sql = "SELECT " + COLUMNS + " FROM reports WHERE id = ?";
        try (Connection con = db.connect(); PreparedStatement ps = con.prepareStatement(sql)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) { throw new RuntimeException(e); }
    }

    /** Newest first; {@code status} empty means all. */
    public List<Report> findAll(Optional<ReportStatus> status) {
        String sql = "SELECT " + COLUMNS + " FROM reports"
                + (status.isPresent() ? " WHERE status = ?" : "")
                + " ORDER BY created_at DESC";
        List<Report> out = new ArrayList<>();
        try (Connection con = db.connect(); PreparedStatement ps = con.prepareStatement(sql)) {
            if (status.isPresent()) ps.setString(1, status.get().wire());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(map(rs));
            }
        } catch (SQLException e) { throw new RuntimeException(e); }
        return out;
    }

    public boolean updateStatus(String id, ReportStatus status) {
        return update("UPDATE reports SET status = ?, updated_at = ? WHERE id = ?",
                status.wire(), Instant.now().toString(), id);
    }

    public boolean activate(String id) { return updateStatus(id, ReportStatus.ACTIVE); }

    public boolean resolve(String id, String sourcePostId, String analysisJson) {
        String now = Instant.now().toString();
        return update("UPDATE reports SET status = ?, source_post_id = ?, analysis_json = ?, resolved_at = ?, "
                        + "updated_at = ? WHERE id = ?",
                ReportStatus.RESOLVED.wire(), sourcePostId, analysisJson, now, now, id);
    }

    public boolean cancel(String id, CancelReason reason) {
        return update("UPDATE reports SET status = ?, cancel_reason = ?, updated_at = ? WHERE id = ?",
                ReportStatus.CANCELLED.wire(), reason.wire(), Instant.now().toString(), id);
    }

    public ReportStatistics statistics() {
        String sql = "SELECT COUNT(*), "
                + "SUM(CASE WHEN status = 'pending' THEN 1 ELSE 0 END), "
                + "SUM(CASE WHEN status = 'active' THEN 1 ELSE 0 END), "
                + "SUM(CASE WHEN status = 'resolved' THEN 1 ELSE 0 END), "
                + "SUM(CASE WHEN status = 'cancelled' THEN 1 ELSE 0 END), "
                + "SUM(CASE WHEN source = 'public' THEN 1 ELSE 0 END), "
                + "SUM(CASE WHEN source = 'auto_monitor' THEN 1 ELSE 0 END) "
                + "FROM reports";
        try (Connection con = db.connect(); PreparedStatement ps = con.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            rs.next();
            // SUM over zero rows is NULL; getInt maps it to 0
            return new ReportStatistics(rs.getInt(1), rs.getInt(2), rs.getInt(3), rs.getInt(4),
                    rs.getInt(5), rs.getInt(6), rs.getInt(7));
        } catch (SQLException e) { throw new RuntimeException(e); }
    }

    private boolean update(String sql, String... params) {
        try (Connection con = db.connect(); PreparedStatement ps = con.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) ps.setString(i + 1, params[i]);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) { throw new RuntimeException(e); }
    }

    private static Report map(ResultSet rs) throws SQLException {
        String resolvedAt = rs.getString("resolved_at");
        String cancelReason = rs.getString("cancel_reason");
        return new Report(
                rs.getString("id"),
                rs.getString("post_url"),
                rs.getString("post_id"),
                rs.getString("description"),
                ReportStatus.fromWire(rs.getString("status")),
                ReportSource.fromWire(rs.getString("source")),
                rs.getString("reporter_name"),
                rs.getString("reporter_phone"),
                rs.getString("reporter_id"),
                Instant.parse(rs.getString("created_at")),
                Instant.parse(rs.getString("updated_at")),
                resolvedAt == null ? null : Instant.parse(resolvedAt),
                cancelReason == null ? null : CancelReason.fromWire(cancelReason),
                rs.getString("source_post_id"),
                rs.getString("analysis_json"));
    }
}
