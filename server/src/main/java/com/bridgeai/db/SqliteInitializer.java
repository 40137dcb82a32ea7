package com.bridgeai.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode = WAL;");

                stmt.execute("CREATE TABLE IF NOT EXISTS model_snapshot (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "name TEXT NOT NULL UNIQUE, " +
                        "state_blob BLOB NOT NULL, " +
                        "history_index INTEGER NOT NULL, " +
                        "created_ts INTEGER NOT NULL" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_snapshot_created " +
                        "ON model_snapshot (created_ts);");
            }
        }
    }
}
