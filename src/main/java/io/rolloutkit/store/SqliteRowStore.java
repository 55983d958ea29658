package io.rolloutkit.store;

import io.rolloutkit.model.EvaluationRow;
import io.rolloutkit.model.StatusCode;
import io.rolloutkit.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Rows in a single SQLite table, upserted by {@code row_id}. */
public final class SqliteRowStore implements RowStore {
    private final Path dbFile;
    private final String jdbcUrl;

    public SqliteRowStore(Path dbFile) {
        this.dbFile = dbFile;
        this.jdbcUrl = "jdbc:sqlite:" + dbFile.toString();
    }

    @Override
    public void init() {
        try {
            Files.createDirectories(dbFile.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            st.execute("PRAGMA busy_timeout=5000");
            st.execute("""
                    CREATE TABLE IF NOT EXISTS evaluation_rows (
                        row_id TEXT PRIMARY KEY,
                        status_code INTEGER,
                        owning_pid INTEGER,
                        row_json TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_evaluation_rows_status ON evaluation_rows(status_code)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite row store", e);
        }
    }

    Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    @Override
    public void log(EvaluationRow row) {
        String sql = """
                INSERT INTO evaluation_rows(row_id,status_code,owning_pid,row_json,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?)
                ON CONFLICT(row_id) DO UPDATE SET
                    status_code=excluded.status_code,
                    owning_pid=excluded.owning_pid,
                    row_json=excluded.row_json,
                    updated_at_ms=excluded.updated_at_ms
                """;
        long now = Instant.now().toEpochMilli();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, row.rowId());
            if (row.rolloutStatus() == null) {
                ps.setNull(2, Types.INTEGER);
            } else {
                ps.setInt(2, row.rolloutStatus().code().code());
            }
            if (row.owningPid() == null) {
                ps.setNull(3, Types.INTEGER);
            } else {
                ps.setLong(3, row.owningPid());
            }
            ps.setString(4, Jsons.toCompactJson(row));
            ps.setLong(5, row.createdAt() == null ? now : row.createdAt().toEpochMilli());
            ps.setLong(6, now);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to log row " + row.rowId(), e);
        }
    }

    @Override
    public List<EvaluationRow> read() {
        return query("SELECT row_json FROM evaluation_rows ORDER BY created_at_ms, row_id", null);
    }

    @Override
    public Optional<EvaluationRow> read(String rowId) {
        List<EvaluationRow> rows = query("SELECT row_json FROM evaluation_rows WHERE row_id=?", ps -> ps.setString(1, rowId));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<EvaluationRow> findByStatus(StatusCode code) {
        return query("SELECT row_json FROM evaluation_rows WHERE status_code=? ORDER BY created_at_ms, row_id",
                ps -> ps.setInt(1, code.code()));
    }

    private List<EvaluationRow> query(String sql, Binder binder) {
        List<EvaluationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (binder != null) {
                binder.bind(ps);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(Jsons.fromJson(rs.getString("row_json"), EvaluationRow.class));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read rows", e);
        }
        return out;
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }
}
