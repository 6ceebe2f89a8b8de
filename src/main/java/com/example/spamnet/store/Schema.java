package com.example.spamnet.store;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

public class Schema {

    public static void createTables(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS spammers (" +
                    "identifier TEXT PRIMARY KEY, " +
                    "note TEXT, " +
                    "reported_at INTEGER NOT NULL, " +
                    "origin_id TEXT NOT NULL, " +
                    "updated_at INTEGER NOT NULL" +
                    ")");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_spammers_updated_at ON spammers(updated_at DESC)");
        }
    }
}
