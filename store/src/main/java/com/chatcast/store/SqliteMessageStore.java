package com.chatcast.store;

import com.chatcast.core.history.HistoryRecord;
import com.chatcast.core.history.MessageStore;
import com.chatcast.core.history.StoreInitException;
import com.chatcast.core.history.StoreReadException;
import com.chatcast.core.history.StoreWriteException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link MessageStore} backed by a SQLite file through a small HikariCP pool.
 *
 * Schema:
 * <pre>
 *   messages(id INTEGER PRIMARY KEY AUTOINCREMENT,
 *            username TEXT NOT NULL,
 *            message  TEXT NOT NULL,
 *            ts       DATETIME DEFAULT now)
 * </pre>
 * The table is emptied on {@link #initialize()}: history lives for one run only.
 */
public final class SqliteMessageStore implements MessageStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteMessageStore.class);

    static final String CREATE_TABLE =
            "CREATE TABLE IF NOT EXISTS messages (" +
                    "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                    "username TEXT NOT NULL, " +
                    "message TEXT NOT NULL, " +
                    "ts DATETIME DEFAULT (strftime('%Y-%m-%d %H:%M:%f','now'))" +
                    ")";

    private static final String CLEAR         = "DELETE FROM messages";
    private static final String INSERT        = "INSERT INTO messages (username, message) VALUES (?, ?)";
    private static final String SELECT_RECENT = "SELECT id, username, message FROM messages ORDER BY id DESC LIMIT ?";

    private final Path path;
    private final int  poolSize;

    private volatile HikariDataSource dataSource;

    public SqliteMessageStore(Path path, int poolSize) {
        this.path     = path;
        this.poolSize = poolSize;
    }

    @Override
    public void initialize() throws StoreInitException {
        HikariConfig config = new HikariConfig();
        config.setPoolName("chatcast-history");
        config.setJdbcUrl("jdbc:sqlite:" + path.toAbsolutePath());
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(5_000);
        // SQLite waits this long on a locked database instead of failing straight away
        config.addDataSourceProperty("busy_timeout", "5000");

        HikariDataSource ds;
        try {
            ds = new HikariDataSource(config);
        } catch (RuntimeException e) {
            throw new StoreInitException("Cannot open sqlite db '" + path + "': " + e.getMessage(), e);
        }

        try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
            try {
                stmt.execute("PRAGMA journal_mode=WAL");
            } catch (SQLException e) {
                log.warn("Failed to set WAL mode: {}", e.getMessage());
            }
            stmt.execute(CREATE_TABLE);
            try {
                int cleared = stmt.executeUpdate(CLEAR);
                log.info("History store ready at {} ({} rows from a previous run cleared)", path, cleared);
            } catch (SQLException e) {
                log.warn("Failed to clear history table: {}", e.getMessage());
            }
        } catch (SQLException e) {
            ds.close();
            throw new StoreInitException("Failed to prepare sqlite db '" + path + "': " + e.getMessage(), e);
        }
        this.dataSource = ds;
    }

    @Override
    public long append(String username, String message) throws StoreWriteException {
        HikariDataSource ds = dataSource;
        if (ds == null) throw new StoreWriteException("store is not open");
        try (Connection conn = ds.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setString(1, username != null ? username : "Anonymous");
            stmt.setString(2, message != null ? message : "");
            stmt.executeUpdate();
            try (ResultSet keys = stmt.getGeneratedKeys()) {
                return keys.next() ? keys.getLong(1) : -1L;
            }
        } catch (SQLException e) {
            throw new StoreWriteException("Failed to insert message: " + e.getMessage(), e);
        }
    }

    @Override
    public List<HistoryRecord> queryRecent(int limit) throws StoreReadException {
        HikariDataSource ds = dataSource;
        if (ds == null) throw new StoreReadException("store is not open");
        List<HistoryRecord> rows = new ArrayList<>();
        try (Connection conn = ds.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_RECENT)) {
            stmt.setInt(1, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String username = rs.getString("username");
                    String message  = rs.getString("message");
                    rows.add(new HistoryRecord(rs.getLong("id"),
                            username != null ? username : "Anonymous",
                            message != null ? message : ""));
                }
            }
        } catch (SQLException e) {
            throw new StoreReadException("Failed to query history: " + e.getMessage(), e);
        }
        return rows;
    }

    @Override
    public void close() {
        HikariDataSource ds = dataSource;
        dataSource = null;
        if (ds != null && !ds.isClosed()) {
            ds.close();
            log.info("History store closed");
        }
    }
}
