package com.relayjobs;

import com.relayjobs.Models.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Per-conversation task queue kept in the relay database. Task ids are sequential within a
 * conversation: {@code t-0001}, {@code t-0002}, ...
 */
public class StoredTaskQueue implements TaskQueue {
    private static final Logger log = LoggerFactory.getLogger(StoredTaskQueue.class);
    private static final Set<String> FINISHED = Set.of("done", "failed", "blocked", "canceled");

    private final String url;

    public StoredTaskQueue(Path dbFile) {
        this.url = "jdbc:sqlite:" + dbFile.toAbsolutePath() + "?busy_timeout=5000";
        init();
    }

    private Connection getConn() throws SQLException {
        Connection c = DriverManager.getConnection(url);
        try (Statement s = c.createStatement()) {
            s.execute("PRAGMA journal_mode=WAL;");
            s.execute("PRAGMA busy_timeout=5000;");
        }
        return c;
    }

    private void init() {
        try (Connection c = getConn(); Statement s = c.createStatement()) {
            s.executeUpdate(
                "CREATE TABLE IF NOT EXISTS tasks (" +
                    "id TEXT, " +
                    "conversation_key TEXT, " +
                    "text TEXT, " +
                    "status TEXT, " +
                    "source_job_id TEXT, " +
                    "attempts INTEGER, " +
                    "last_error TEXT, " +
                    "created_at TEXT, " +
                    "started_at TEXT, " +
                    "finished_at TEXT, " +
                    "PRIMARY KEY (conversation_key, id))"
            );
        } catch (SQLException e) {
            throw new RelayException(ErrorCode.STORE_ERROR, "Failed to initialise task queue: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized String enqueue(String conversationKey, String text, String sourceJobId) {
        try (Connection c = getConn()) {
            c.setAutoCommit(false);
            String id = nextTaskId(c, conversationKey);
            Task t = new Task(id, conversationKey, text, sourceJobId);
            try (PreparedStatement ins = c.prepareStatement(
                "INSERT INTO tasks (id, conversation_key, text, status, source_job_id, attempts, last_error, created_at, started_at, finished_at) " +
                    "VALUES (?,?,?,?,?,?,?,?,?,?)")) {
                ins.setString(1, t.id);
                ins.setString(2, t.conversationKey);
                ins.setString(3, t.text);
                ins.setString(4, t.status);
                ins.setString(5, t.sourceJobId);
                ins.setInt(6, t.attempts);
                ins.setString(7, null);
                ins.setString(8, t.createdAt);
                ins.setString(9, null);
                ins.setString(10, null);
                ins.executeUpdate();
            }
            c.commit();
            log.info("Queued task {} for conversation {} (source job {})", id, conversationKey, sourceJobId);
            return id;
        } catch (SQLException e) {
            throw new RelayException(ErrorCode.CALLBACK_ENQUEUE_FAILED, "Failed to enqueue task: " + e.getMessage(), e);
        }
    }

    public List<Task> list(String conversationKey) {
        String sql = conversationKey == null
            ? "SELECT * FROM tasks ORDER BY created_at ASC, id ASC"
            : "SELECT * FROM tasks WHERE conversation_key=? ORDER BY id ASC";
        try (Connection c = getConn(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (conversationKey != null) ps.setString(1, conversationKey);
            try (ResultSet rs = ps.executeQuery()) {
                List<Task> out = new ArrayList<>();
                while (rs.next()) out.add(map(rs));
                return out;
            }
        } catch (SQLException e) {
            throw new RelayException(ErrorCode.STORE_ERROR, "Failed to list tasks: " + e.getMessage(), e);
        }
    }

    public Optional<Task> find(String conversationKey, String taskId) {
        try (Connection c = getConn(); PreparedStatement ps = c.prepareStatement(
            "SELECT * FROM tasks WHERE conversation_key=? AND id=?")) {
            ps.setString(1, conversationKey);
            ps.setString(2, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RelayException(ErrorCode.STORE_ERROR, "Failed to read task: " + e.getMessage(), e);
        }
    }

    public synchronized Optional<Task> claimNext(String conversationKey) {
        try (Connection c = getConn()) {
            String id;
            try (PreparedStatement sel = c.prepareStatement(
                "SELECT id FROM tasks WHERE conversation_key=? AND status='pending' ORDER BY id ASC LIMIT 1")) {
                sel.setString(1, conversationKey);
                try (ResultSet rs = sel.executeQuery()) {
                    if (!rs.next()) return Optional.empty();
                    id = rs.getString(1);
                }
            }
            try (PreparedStatement upd = c.prepareStatement(
                "UPDATE tasks SET status='running', attempts=attempts+1, started_at=? WHERE conversation_key=? AND id=? AND status='pending'")) {
                upd.setString(1, Models.nowIso());
                upd.setString(2, conversationKey);
                upd.setString(3, id);
                if (upd.executeUpdate() != 1) return Optional.empty();
            }
            return find(conversationKey, id);
        } catch (SQLException e) {
            throw new RelayException(ErrorCode.STORE_ERROR, "Failed to claim task: " + e.getMessage(), e);
        }
    }

    public synchronized Optional<Task> finish(String conversationKey, String taskId, String status, String error) {
        if (!FINISHED.contains(status)) {
            throw new IllegalArgumentException("Unknown final task status: " + status);
        }
        try (Connection c = getConn(); PreparedStatement upd = c.prepareStatement(
            "UPDATE tasks SET status=?, last_error=?, finished_at=? WHERE conversation_key=? AND id=? AND status IN ('pending','running')")) {
            upd.setString(1, status);
            upd.setString(2, error);
            upd.setString(3, Models.nowIso());
            upd.setString(4, conversationKey);
            upd.setString(5, taskId);
            if (upd.executeUpdate() != 1) return Optional.empty();
        } catch (SQLException e) {
            throw new RelayException(ErrorCode.STORE_ERROR, "Failed to finish task: " + e.getMessage(), e);
        }
        return find(conversationKey, taskId);
    }

    private String nextTaskId(Connection c, String conversationKey) throws SQLException {
        int max = 0;
        try (PreparedStatement ps = c.prepareStatement("SELECT id FROM tasks WHERE conversation_key=?")) {
            ps.setString(1, conversationKey);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String id = rs.getString(1);
                    if (id != null && id.matches("t-\\d{4,}")) {
                        max = Math.max(max, Integer.parseInt(id.substring(2)));
                    }
                }
            }
        }
        return String.format("t-%04d", max + 1);
    }

    private static Task map(ResultSet r) throws SQLException {
        Task t = new Task();
        t.id = r.getString("id");
        t.conversationKey = r.getString("conversation_key");
        t.text = r.getString("text");
        t.status = r.getString("status");
        t.sourceJobId = r.getString("source_job_id");
        t.attempts = r.getInt("attempts");
        t.lastError = r.getString("last_error");
        t.createdAt = r.getString("created_at");
        t.startedAt = r.getString("started_at");
        t.finishedAt = r.getString("finished_at");
        return t;
    }
}
