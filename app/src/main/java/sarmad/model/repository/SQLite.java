package sarmad.model.repository;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SQLite {
    private static final String MIGRATION = "/sql/migrate.sql";

    private final String dbPath;

    public SQLite(String dbPath) {
        this.dbPath = dbPath;
    }

    public String path() { return dbPath; }

    /** A fresh connection; callers close it with try-with-resources. */
    public Connection connect() {
        try {
            return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
        } catch (SQLException e) {
            throw new RuntimeException(e);
        }
    }

    public void migrate() {
        String sql;
        try (InputStream in = getClass().getResourceAsStream(MIGRATION)) {
            if (in == null) throw new RuntimeException("Migration file not found at " + MIGRATION);
            sql = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        try (Connection con = connect(); Statement stmt = con.createStatement()) {
            for (String part : sql.split(";")) {
                if (!part.isBlank()) stmt.executeUpdate(part);
            }
        } catch (SQLException e) {
            throw new RuntimeException(e);
        }
    }
}
