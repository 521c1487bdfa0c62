package com.relayjobs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relayjobs.Models.HistoryEntry;
import com.relayjobs.Models.Job;
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
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Durable job registry backed by SQLite.
 *
 * <p>Every mutation of a job happens while holding that job's lock. State changes are additionally
 * compare-and-set on the stored state, so a writer in another process that already moved the job
 * on makes the transition a no-op instead of overwriting it. History rows are only ever inserted.
 * Jobs that reach a terminal state are moved to {@code archived_jobs} in the same transaction.
 */
public class LifecycleStore {
    private static final Logger log = LoggerFactory.getLogger(LifecycleStore.class);

    private final ObjectMapper mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final String url;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    // archived ids whose lock is dropped once the last holder releases it
    private final Set<String> retired = ConcurrentHashMap.newKeySet();

    public LifecycleStore(Path dbFile) {
        Path parent = dbFile.toAbsolutePath().getParent();
        if (parent != null) parent.toFile().mkdirs();
        this.url = "jdbc:sqlite:" + dbFile.toAbsolutePath() + "?busy_timeout=5000";
        init();
    }

    Connection getConn() throws SQLException {
        Connection c = DriverManager.getConnection(url);
        try (Statement s = c.createStatement()) {
            s.execute("PRAGMA journal_mode=WAL;");
            s.execute("PRAGMA busy_timeout=5000;");
        }
        return c;
    }

    private void init() {
        try (Connection c = getConn(); Statement s = c.createStatement()) {
            for (String table : new String[]{"jobs", "archived_jobs"}) {
                s.executeUpdate(
                    "CREATE TABLE IF NOT EXISTS " + table + " (" +
                        "id TEXT PRIMARY KEY, " +
                        "conversation_key TEXT, " +
                        "state TEXT, " +
                        "callback_enqueued INTEGER, " +
                        "cancel_requested INTEGER DEFAULT 0, " +
                        "payload TEXT, " +
                        "created_at TEXT, " +
                        "updated_at TEXT)"
                );
            }
            s.executeUpdate(
                "CREATE TABLE IF NOT EXISTS job_history (" +
                    "job_id TEXT, " +
                    "seq INTEGER, " +
                    "state TEXT, " +
                    "at TEXT, " +
                    "reason TEXT, " +
                    "details TEXT, " +
                    "PRIMARY KEY (job_id, seq))"
            );
        } catch (SQLException e) {
            throw storeError("initialise job store", e);
        }
    }

    public Job create(Job job, String reason, ObjectNode details) {
        return withLock(job.id, () -> {
            if (find(job.id).isPresent()) {
                throw new RelayException(ErrorCode.INVALID_REQUEST, "Job id already exists: " + job.id);
            }
            job.updatedAt = Models.nowIso();
            job.reason = reason;
            HistoryEntry entry = new HistoryEntry(job.state, job.updatedAt, reason, details);
            retryOnBusy(() -> {
                try (Connection c = getConn()) {
                    c.setAutoCommit(false);
                    try (PreparedStatement ins = c.prepareStatement(
                        "INSERT INTO jobs (id, conversation_key, state, callback_enqueued, cancel_requested, payload, created_at, updated_at) " +
                            "VALUES (?,?,?,?,0,?,?,?)")) {
                        ins.setString(1, job.id);
                        ins.setString(2, job.conversationKey);
                        ins.setString(3, job.state.wire());
                        ins.setInt(4, job.callbackEnqueued ? 1 : 0);
                        ins.setString(5, payload(job));
                        ins.setString(6, job.createdAt);
                        ins.setString(7, job.updatedAt);
                        ins.executeUpdate();
                    }
                    appendHistory(c, job.id, entry);
                    c.commit();
                }
                return null;
            });
            job.history = new ArrayList<>(List.of(entry));
            return job;
        });
    }

    /**
     * Moves a live job from {@code from} to {@code to}. Returns empty when the job is no longer in
     * {@code from} (a duplicate or stale evaluation); throws when the edge is not in the graph.
     */
    public Optional<Job> transition(String id, JobState from, JobState to, String reason, ObjectNode details, Consumer<Job> mutator) {
        if (!from.canTransitionTo(to)) throw new IllegalStateTransitionException(id, from, to);
        return withLock(id, () -> {
            Optional<Job> current = findLive(id);
            if (current.isEmpty() || current.get().state != from) {
                log.debug("Job {} not in state {} (now {}), skipping transition to {}",
                    id, from, current.map(j -> j.state.wire()).orElse("archived"), to);
                return Optional.empty();
            }
            Job job = current.get();
            if (mutator != null) mutator.accept(job);
            job.state = to;
            if (to != JobState.RUNNING) job.pid = null;
            job.reason = reason;
            job.updatedAt = Models.nowIso();
            HistoryEntry entry = new HistoryEntry(to, job.updatedAt, reason, details);
            boolean applied = retryOnBusy(() -> {
                try (Connection c = getConn()) {
                    c.setAutoCommit(false);
                    int updated;
                    try (PreparedStatement up = c.prepareStatement(
                        "UPDATE jobs SET state=?, callback_enqueued=?, payload=?, updated_at=? WHERE id=? AND state=?")) {
                        up.setString(1, to.wire());
                        up.setInt(2, job.callbackEnqueued ? 1 : 0);
                        up.setString(3, payload(job));
                        up.setString(4, job.updatedAt);
                        up.setString(5, id);
                        up.setString(6, from.wire());
                        updated = up.executeUpdate();
                    }
                    if (updated != 1) {
                        c.rollback();
                        return false;
                    }
                    appendHistory(c, id, entry);
                    if (to.isTerminal()) archive(c, id);
                    c.commit();
                    return true;
                }
            });
            if (!applied) {
                log.debug("Job {} changed state concurrently, skipping transition {} -> {}", id, from, to);
                return Optional.empty();
            }
            job.history.add(entry);
            if (to.isTerminal()) retired.add(id);
            return Optional.of(job);
        });
    }

    public void note(String id, String reason, ObjectNode details) {
        withLock(id, () -> {
            Job job = findLive(id).orElseThrow(() -> notFound(id));
            HistoryEntry entry = new HistoryEntry(job.state, Models.nowIso(), reason, details);
            retryOnBusy(() -> {
                try (Connection c = getConn()) {
                    c.setAutoCommit(false);
                    appendHistory(c, id, entry);
                    c.commit();
                }
                return null;
            });
            return null;
        });
    }

    /** Mutates non-state fields of a live job (tail, visibility). Empty when the job is archived. */
    public Optional<Job> update(String id, Consumer<Job> mutator) {
        return withLock(id, () -> {
            Optional<Job> current = findLive(id);
            if (current.isEmpty()) return Optional.empty();
            Job job = current.get();
            JobState before = job.state;
            mutator.accept(job);
            job.state = before;
            job.updatedAt = Models.nowIso();
            retryOnBusy(() -> {
                try (Connection c = getConn(); PreparedStatement up = c.prepareStatement(
                    "UPDATE jobs SET payload=?, updated_at=? WHERE id=? AND state=?")) {
                    up.setString(1, payload(job));
                    up.setString(2, job.updatedAt);
                    up.setString(3, id);
                    up.setString(4, before.wire());
                    up.executeUpdate();
                }
                return null;
            });
            return Optional.of(job);
        });
    }

    /**
     * Flags a live job for cancellation. Kept in its own column so a watcher in another process
     * rewriting the payload cannot lose the flag.
     */
    public Optional<Job> requestCancel(String id) {
        return withLock(id, () -> {
            int updated = retryOnBusy(() -> {
                try (Connection c = getConn(); PreparedStatement up = c.prepareStatement(
                    "UPDATE jobs SET cancel_requested=1, updated_at=? WHERE id=?")) {
                    up.setString(1, Models.nowIso());
                    up.setString(2, id);
                    return up.executeUpdate();
                }
            });
            return updated == 1 ? findLive(id) : Optional.<Job>empty();
        });
    }

    public <T> T withLock(String id, Supplier<T> body) {
        ReentrantLock lock = locks.computeIfAbsent(id, k -> new ReentrantLock());
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
            if (lock.getHoldCount() == 0 && !lock.hasQueuedThreads() && retired.remove(id)) {
                locks.remove(id, lock);
            }
        }
    }

    boolean hasLock(String id) {
        return locks.containsKey(id);
    }

    public Optional<Job> find(String id) {
        Optional<Job> live = findLive(id);
        return live.isPresent() ? live : findIn("archived_jobs", id);
    }

    public Job get(String id) {
        return find(id).orElseThrow(() -> notFound(id));
    }

    public Optional<Job> findLive(String id) {
        return findIn("jobs", id);
    }

    public List<Job> list(JobState state) {
        return listFrom("jobs", state);
    }

    public List<Job> listArchived(JobState state) {
        return listFrom("archived_jobs", state);
    }

    public List<HistoryEntry> history(String id) {
        return retryOnBusy(() -> {
            try (Connection c = getConn()) {
                return loadHistory(c, id);
            }
        });
    }

    private Optional<Job> findIn(String table, String id) {
        return retryOnBusy(() -> {
            try (Connection c = getConn(); PreparedStatement ps = c.prepareStatement("SELECT * FROM " + table + " WHERE id=?")) {
                ps.setString(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) return Optional.<Job>empty();
                    Job job = map(rs);
                    job.history = loadHistory(c, id);
                    return Optional.of(job);
                }
            }
        });
    }

    private List<Job> listFrom(String table, JobState state) {
        String sql = state == null
            ? "SELECT * FROM " + table + " ORDER BY created_at ASC"
            : "SELECT * FROM " + table + " WHERE state=? ORDER BY created_at ASC";
        return retryOnBusy(() -> {
            try (Connection c = getConn(); PreparedStatement ps = c.prepareStatement(sql)) {
                if (state != null) ps.setString(1, state.wire());
                List<Job> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(map(rs));
                }
                for (Job j : out) j.history = loadHistory(c, j.id);
                return out;
            }
        });
    }

    private void appendHistory(Connection c, String id, HistoryEntry entry) throws SQLException {
        int seq;
        try (PreparedStatement max = c.prepareStatement("SELECT COALESCE(MAX(seq), 0) + 1 FROM job_history WHERE job_id=?")) {
            max.setString(1, id);
            try (ResultSet rs = max.executeQuery()) {
                rs.next();
                seq = rs.getInt(1);
            }
        }
        try (PreparedStatement ins = c.prepareStatement(
            "INSERT INTO job_history (job_id, seq, state, at, reason, details) VALUES (?,?,?,?,?,?)")) {
            ins.setString(1, id);
            ins.setInt(2, seq);
            ins.setString(3, entry.state.wire());
            ins.setString(4, entry.at);
            ins.setString(5, entry.reason);
            ins.setString(6, entry.details == null ? null : write(entry.details));
            ins.executeUpdate();
        }
    }

    private List<HistoryEntry> loadHistory(Connection c, String id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT * FROM job_history WHERE job_id=? ORDER BY seq ASC")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                List<HistoryEntry> out = new ArrayList<>();
                while (rs.next()) {
                    String details = rs.getString("details");
                    out.add(new HistoryEntry(
                        JobState.fromWire(rs.getString("state")),
                        rs.getString("at"),
                        rs.getString("reason"),
                        details == null ? null : read(details, ObjectNode.class)));
                }
                return out;
            }
        }
    }

    private void archive(Connection c, String id) throws SQLException {
        try (PreparedStatement ins = c.prepareStatement(
            "INSERT INTO archived_jobs (id, conversation_key, state, callback_enqueued, cancel_requested, payload, created_at, updated_at) " +
                "SELECT id, conversation_key, state, callback_enqueued, cancel_requested, payload, created_at, updated_at FROM jobs WHERE id=? " +
                "ON CONFLICT(id) DO UPDATE SET state=excluded.state, callback_enqueued=excluded.callback_enqueued, payload=excluded.payload, updated_at=excluded.updated_at")) {
            ins.setString(1, id);
            ins.executeUpdate();
        }
        try (PreparedStatement del = c.prepareStatement("DELETE FROM jobs WHERE id=?")) {
            del.setString(1, id);
            del.executeUpdate();
        }
    }

    private Job map(ResultSet r) throws SQLException {
        Job j = read(r.getString("payload"), Job.class);
        j.id = r.getString("id");
        j.conversationKey = r.getString("conversation_key");
        j.state = JobState.fromWire(r.getString("state"));
        j.callbackEnqueued = r.getInt("callback_enqueued") == 1;
        j.cancelRequested = r.getInt("cancel_requested") == 1;
        j.createdAt = r.getString("created_at");
        j.updatedAt = r.getString("updated_at");
        return j;
    }

    private String payload(Job job) {
        ObjectNode node = mapper.valueToTree(job);
        node.remove("history");
        node.remove("cancelRequested");
        return write(node);
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RelayException(ErrorCode.STORE_ERROR, "Could not serialise job data", e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new RelayException(ErrorCode.STORE_ERROR, "Corrupt job data in store", e);
        }
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run() throws SQLException;
    }

    private <T> T retryOnBusy(SqlWork<T> work) {
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                return work.run();
            } catch (SQLException e) {
                if (isBusy(e) && attempts < 20) {
                    sleepQuiet(100L);
                    continue;
                }
                throw storeError("access job store", e);
            }
        }
    }

    private static boolean isBusy(SQLException e) {
        String msg = e.getMessage();
        return msg != null && (msg.contains("database is locked") || msg.contains("SQLITE_BUSY"));
    }

    private static void sleepQuiet(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static RelayException storeError(String what, SQLException e) {
        return new RelayException(ErrorCode.STORE_ERROR, "Failed to " + what + ": " + e.getMessage(), e);
    }

    private static RelayException notFound(String id) {
        return new RelayException(ErrorCode.INVALID_REQUEST, "No such job: " + id);
    }
}
