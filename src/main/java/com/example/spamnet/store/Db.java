package com.example.spamnet.store;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One SQLite database file and the single JDBC connection used to reach it.
 * DAOs synchronise on the {@code Db} instance around each operation.
 */
public class Db implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Db.class);

    private final String path;
    private Connection connection;
    private boolean closed;

    private Db(String path) {
        this.path = path;
    }

    /** Opens (creating if absent) the database at {@code path} and ensures the schema. */
    public static Db open(String path) throws SQLException {
        try {
            Class.forName("org.sqlite.JDBC");
        } catch (ClassNotFoundException e) {
            throw new SQLException("SQLite JDBC Driver not found", e);
        }
        Db db = new Db(path);
        db.connect();
        LOG.info("Database ready: {}", path);
        return db;
    }

    private void connect() throws SQLException {
        connection = DriverManager.getConnection("jdbc:sqlite:" + path);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL;");
            // fsync on every commit: an acknowledged write survives a crash
            stmt.execute("PRAGMA synchronous=FULL;");
            stmt.execute("PRAGMA busy_timeout=5000;");
        }
        Schema.createTables(connection);
    }

    public String path() {
        return path;
    }

    public synchronized Connection getConnection() throws SQLException {
        if (closed) {
            throw new SQLException("Database closed: " + path);
        }
        if (connection == null || connection.isClosed()) {
            connect();
        }
        return connection;
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        if (connection != null) {
            try {
                connection.close();
                LOG.info("Database closed: {}", path);
            } catch (SQLException e) {
                LOG.warn("Closing database {} failed", path, e);
            }
        }
    }
}
