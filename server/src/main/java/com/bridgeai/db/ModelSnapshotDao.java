package com.bridgeai.db;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ModelSnapshotDao {

    private final String dbPath;

    public ModelSnapshotDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    /** Inserts the snapshot, replacing any existing one with the same name. */
    public void upsert(String name, byte[] stateBlob, long historyIndex) throws SQLException {
        long now = System.currentTimeMillis();
        String sql = "INSERT INTO model_snapshot (name, state_blob, history_index, created_ts) " +
                "VALUES (?, ?, ?, ?) " +
                "ON CONFLICT(name) DO UPDATE SET " +
                "state_blob = excluded.state_blob, history_index = excluded.history_index, " +
                "created_ts = excluded.created_ts";

        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, name);
            ps.setBytes(2, stateBlob);
            ps.setLong(3, historyIndex);
            ps.setLong(4, now);
            ps.executeUpdate();
        }
    }

    public Optional<byte[]> loadBlob(String name) throws SQLException {
        String sql = "SELECT state_blob FROM model_snapshot WHERE name = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getBytes("state_blob"));
                }
            }
        }
        return Optional.empty();
    }

    public List<ModelSnapshot> list() throws SQLException {
        String sql = "SELECT id, name, history_index, length(state_blob) AS size_bytes, created_ts " +
                "FROM model_snapshot ORDER BY created_ts DESC, id DESC";
        List<ModelSnapshot> out = new ArrayList<>();
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new ModelSnapshot(
                        rs.getLong("id"),
                        rs.getString("name"),
                        rs.getLong("history_index"),
                        rs.getInt("size_bytes"),
                        rs.getLong("created_ts")));
            }
        }
        return out;
    }

    /** @return true if a row was removed */
    public boolean delete(String name) throws SQLException {
        String sql = "DELETE FROM model_snapshot WHERE name = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, name);
            return ps.executeUpdate() > 0;
        }
    }
}
