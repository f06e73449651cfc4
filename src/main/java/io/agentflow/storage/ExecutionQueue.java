package io.agentflow.storage;

import io.agentflow.error.InfrastructureException;
import io.agentflow.error.ValidationException;
import io.agentflow.model.QueueItem;
import io.agentflow.model.QueueSource;
import io.agentflow.model.QueueStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Persisted execution queue. Dispatch order within an organization is priority (lower first),
 * then availability time, then enqueue order. The {@code pending -> executing} transition is a
 * compare-and-swap on the row status, so a queue item is held by at most one worker.
 */
public final class ExecutionQueue {
    private static final Logger log = LoggerFactory.getLogger(ExecutionQueue.class);
    private static final int MAX_CLAIM_ATTEMPTS = 8;
    private static final String ITEM_COLUMNS = "id,seq,organization_id,agent_id,owner_id,source,schedule_execution_id,status,priority,"
            + "payload,retry_count,max_retries,result,last_error,claimed_by,available_at_ms,created_at_ms,updated_at_ms";

    private final Database database;
    private final List<TransitionListener> listeners = new CopyOnWriteArrayList<>();

    public ExecutionQueue(Database database) {
        this.database = database;
    }

    public void addListener(TransitionListener listener) {
        listeners.add(listener);
    }

    public String enqueue(EnqueueRequest req, long nowMs) {
        validate(req);
        String id = "exec_" + UUID.randomUUID();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO execution_queue(id,organization_id,agent_id,owner_id,source,schedule_execution_id,status,priority,payload,"
                             + "retry_count,max_retries,available_at_ms,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?)")) {
            ps.setString(1, id);
            ps.setString(2, req.organizationId());
            ps.setString(3, req.agentId());
            ps.setString(4, req.ownerId());
            ps.setString(5, req.source().dbValue());
            ps.setString(6, req.scheduleExecutionId());
            ps.setString(7, QueueStatus.PENDING.dbValue());
            ps.setInt(8, req.priority());
            ps.setString(9, req.payload() == null || req.payload().isBlank() ? "{}" : req.payload());
            ps.setInt(10, 0);
            ps.setInt(11, req.maxRetries());
            ps.setLong(12, nowMs);
            ps.setLong(13, nowMs);
            ps.setLong(14, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to enqueue execution for agent " + req.agentId(), e);
        }
        log.debug("Enqueued {} for agent {} (org={}, priority={}, source={})",
                id, req.agentId(), req.organizationId(), req.priority(), req.source());
        return id;
    }

    /**
     * Claims the next dispatchable item of an organization. Returns empty when nothing is pending
     * or every candidate was taken by a concurrent worker.
     */
    public Optional<QueueItem> claim(String organizationId, String workerId, long nowMs) {
        String select = "SELECT id FROM execution_queue WHERE organization_id=? AND status=? AND available_at_ms<=? "
                + "ORDER BY priority ASC, available_at_ms ASC, seq ASC LIMIT 1";
        String cas = "UPDATE execution_queue SET status=?,claimed_by=?,started_at_ms=?,updated_at_ms=? WHERE id=? AND status=?";
        try (Connection c = database.openConnection();
             PreparedStatement find = c.prepareStatement(select);
             PreparedStatement update = c.prepareStatement(cas)) {
            for (int attempt = 0; attempt < MAX_CLAIM_ATTEMPTS; attempt++) {
                find.setString(1, organizationId);
                find.setString(2, QueueStatus.PENDING.dbValue());
                find.setLong(3, nowMs);
                String candidate;
                try (ResultSet rs = find.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    candidate = rs.getString("id");
                }
                update.setString(1, QueueStatus.EXECUTING.dbValue());
                update.setString(2, workerId);
                update.setLong(3, nowMs);
                update.setLong(4, nowMs);
                update.setString(5, candidate);
                update.setString(6, QueueStatus.PENDING.dbValue());
                if (update.executeUpdate() == 1) {
                    Optional<QueueItem> claimed = readItem(c, candidate);
                    fire(candidate, QueueStatus.EXECUTING);
                    return claimed;
                }
                recordClaimConflict(c, candidate, workerId, nowMs);
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to claim execution for organization " + organizationId, e);
        }
    }

    public boolean complete(String id, String result, long nowMs) {
        String sql = "UPDATE execution_queue SET status=?,result=?,last_error=NULL,claimed_by=NULL,completed_at_ms=?,updated_at_ms=? "
                + "WHERE id=? AND status IN (?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, QueueStatus.COMPLETED.dbValue());
            ps.setString(2, result);
            ps.setLong(3, nowMs);
            ps.setLong(4, nowMs);
            ps.setString(5, id);
            ps.setString(6, QueueStatus.PENDING.dbValue());
            ps.setString(7, QueueStatus.EXECUTING.dbValue());
            if (ps.executeUpdate() == 0) {
                return false;
            }
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to complete execution " + id, e);
        }
        fire(id, QueueStatus.COMPLETED);
        return true;
    }

    /**
     * Records a counted failure. The item goes back to {@code pending} while attempts remain,
     * otherwise it becomes terminally {@code failed}.
     */
    public FailureResolution fail(String id, String error, long backoffMs, long nowMs) {
        FailureResolution resolution;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement read = c.prepareStatement("SELECT status,retry_count,max_retries FROM execution_queue WHERE id=?");
                 PreparedStatement retry = c.prepareStatement(
                         "UPDATE execution_queue SET status=?,retry_count=?,last_error=?,claimed_by=NULL,available_at_ms=?,updated_at_ms=? "
                                 + "WHERE id=? AND status=? AND retry_count=?");
                 PreparedStatement dead = c.prepareStatement(
                         "UPDATE execution_queue SET status=?,retry_count=?,last_error=?,claimed_by=NULL,completed_at_ms=?,updated_at_ms=? "
                                 + "WHERE id=? AND status=? AND retry_count=?")) {
                read.setString(1, id);
                QueueStatus status;
                int retryCount;
                int maxRetries;
                try (ResultSet rs = read.executeQuery()) {
                    if (!rs.next()) {
                        c.commit();
                        return FailureResolution.notActive(null);
                    }
                    status = QueueStatus.fromString(rs.getString("status"));
                    retryCount = rs.getInt("retry_count");
                    maxRetries = rs.getInt("max_retries");
                }
                if (status.isTerminal()) {
                    c.commit();
                    return FailureResolution.notActive(status);
                }
                int next = retryCount + 1;
                if (next < maxRetries) {
                    retry.setString(1, QueueStatus.PENDING.dbValue());
                    retry.setInt(2, next);
                    retry.setString(3, error);
                    retry.setLong(4, nowMs + Math.max(0L, backoffMs));
                    retry.setLong(5, nowMs);
                    retry.setString(6, id);
                    retry.setString(7, status.dbValue());
                    retry.setInt(8, retryCount);
                    if (retry.executeUpdate() == 0) {
                        c.rollback();
                        return FailureResolution.notActive(status);
                    }
                    resolution = FailureResolution.retryScheduled(next, maxRetries);
                } else {
                    int finalCount = Math.min(next, maxRetries);
                    dead.setString(1, QueueStatus.FAILED.dbValue());
                    dead.setInt(2, finalCount);
                    dead.setString(3, error);
                    dead.setLong(4, nowMs);
                    dead.setLong(5, nowMs);
                    dead.setString(6, id);
                    dead.setString(7, status.dbValue());
                    dead.setInt(8, retryCount);
                    if (dead.executeUpdate() == 0) {
                        c.rollback();
                        return FailureResolution.notActive(status);
                    }
                    resolution = FailureResolution.failed(finalCount, maxRetries);
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to record failure for execution " + id, e);
        }
        fire(id, resolution.outcome() == FailureOutcome.FAILED ? QueueStatus.FAILED : QueueStatus.PENDING);
        return resolution;
    }

    /**
     * Returns a claimed item to {@code pending} without consuming a retry.
     */
    public boolean release(String id, String reason, long delayMs, long nowMs) {
        String sql = "UPDATE execution_queue SET status=?,last_error=?,claimed_by=NULL,available_at_ms=?,updated_at_ms=? WHERE id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, QueueStatus.PENDING.dbValue());
            ps.setString(2, reason);
            ps.setLong(3, nowMs + Math.max(0L, delayMs));
            ps.setLong(4, nowMs);
            ps.setString(5, id);
            ps.setString(6, QueueStatus.EXECUTING.dbValue());
            if (ps.executeUpdate() == 0) {
                return false;
            }
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to release execution " + id, e);
        }
        fire(id, QueueStatus.PENDING);
        return true;
    }

    public boolean cancel(String id, long nowMs) {
        String sql = "UPDATE execution_queue SET status=?,last_error=?,completed_at_ms=?,updated_at_ms=? WHERE id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, QueueStatus.CANCELLED.dbValue());
            ps.setString(2, "cancelled");
            ps.setLong(3, nowMs);
            ps.setLong(4, nowMs);
            ps.setString(5, id);
            ps.setString(6, QueueStatus.PENDING.dbValue());
            if (ps.executeUpdate() == 0) {
                return false;
            }
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to cancel execution " + id, e);
        }
        fire(id, QueueStatus.CANCELLED);
        return true;
    }

    public List<String> cancelPendingForAgent(String agentId, long nowMs) {
        return cancelPendingWhere("agent_id=?", agentId, nowMs);
    }

    /**
     * Cancels the not-yet-claimed items derived from any execution of the given schedule.
     */
    public List<String> cancelPendingForSchedule(String scheduleId, long nowMs) {
        return cancelPendingWhere(
                "schedule_execution_id IN (SELECT id FROM scheduled_executions WHERE schedule_id=?)",
                scheduleId,
                nowMs
        );
    }

    private List<String> cancelPendingWhere(String predicate, String arg, long nowMs) {
        List<String> ids = new ArrayList<>();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement select = c.prepareStatement(
                    "SELECT id FROM execution_queue WHERE status=? AND " + predicate + " ORDER BY seq");
                 PreparedStatement update = c.prepareStatement(
                         "UPDATE execution_queue SET status=?,last_error=?,completed_at_ms=?,updated_at_ms=? WHERE id=? AND status=?")) {
                select.setString(1, QueueStatus.PENDING.dbValue());
                select.setString(2, arg);
                List<String> candidates = new ArrayList<>();
                try (ResultSet rs = select.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(rs.getString("id"));
                    }
                }
                for (String id : candidates) {
                    update.setString(1, QueueStatus.CANCELLED.dbValue());
                    update.setString(2, "cancelled");
                    update.setLong(3, nowMs);
                    update.setLong(4, nowMs);
                    update.setString(5, id);
                    update.setString(6, QueueStatus.PENDING.dbValue());
                    if (update.executeUpdate() == 1) {
                        ids.add(id);
                    }
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to cancel pending executions", e);
        }
        for (String id : ids) {
            fire(id, QueueStatus.CANCELLED);
        }
        return ids;
    }

    public Optional<QueueItemStatus> getQueueItemStatus(String id) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT status,result,last_error,retry_count,max_retries FROM execution_queue WHERE id=?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new QueueItemStatus(
                        id,
                        QueueStatus.fromString(rs.getString("status")),
                        rs.getString("result"),
                        rs.getString("last_error"),
                        rs.getInt("retry_count"),
                        rs.getInt("max_retries")
                ));
            }
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to read execution status " + id, e);
        }
    }

    public Optional<QueueItem> find(String id) {
        try (Connection c = database.openConnection()) {
            return readItem(c, id);
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to read execution " + id, e);
        }
    }

    public List<QueueItem> recentForAgent(String agentId, int limit) {
        List<QueueItem> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + ITEM_COLUMNS + " FROM execution_queue WHERE agent_id=? ORDER BY seq DESC LIMIT ?")) {
            ps.setString(1, agentId);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapItem(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to list executions for agent " + agentId, e);
        }
    }

    public int countForAgent(String agentId, QueueStatus status) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM execution_queue WHERE agent_id=? AND status=?")) {
            ps.setString(1, agentId);
            ps.setString(2, status.dbValue());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to count executions for agent " + agentId, e);
        }
    }

    public List<String> organizationsWithPending(long nowMs) {
        List<String> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT DISTINCT organization_id FROM execution_queue WHERE status=? AND available_at_ms<=? ORDER BY organization_id")) {
            ps.setString(1, QueueStatus.PENDING.dbValue());
            ps.setLong(2, nowMs);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to list organizations with pending work", e);
        }
    }

    public Map<String, Integer> pendingDepthByOrganization() {
        Map<String, Integer> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT organization_id, COUNT(*) AS depth FROM execution_queue WHERE status=? GROUP BY organization_id ORDER BY organization_id")) {
            ps.setString(1, QueueStatus.PENDING.dbValue());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getString("organization_id"), rs.getInt("depth"));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to read queue depth", e);
        }
    }

    public Map<String, Integer> statusCounts() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (QueueStatus status : QueueStatus.values()) {
            out.put(status.dbValue(), 0);
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT status, COUNT(*) AS n FROM execution_queue GROUP BY status")) {
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getString("status"), rs.getInt("n"));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to read queue status counts", e);
        }
    }

    public int claimConflictCount() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM queue_claim_conflicts");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to count claim conflicts", e);
        }
    }

    private void recordClaimConflict(Connection c, String itemId, String workerId, long nowMs) throws SQLException {
        String actual = null;
        try (PreparedStatement read = c.prepareStatement("SELECT status FROM execution_queue WHERE id=?")) {
            read.setString(1, itemId);
            try (ResultSet rs = read.executeQuery()) {
                if (rs.next()) {
                    actual = rs.getString("status");
                }
            }
        }
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO queue_claim_conflicts(queue_item_id,worker_id,actual_status,occurred_at_ms) VALUES(?,?,?,?)")) {
            ps.setString(1, itemId);
            ps.setString(2, workerId);
            ps.setString(3, actual);
            ps.setLong(4, nowMs);
            ps.executeUpdate();
        }
        log.debug("Worker {} lost claim race on {} (actual status {})", workerId, itemId, actual);
    }

    private Optional<QueueItem> readItem(Connection c, String id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + ITEM_COLUMNS + " FROM execution_queue WHERE id=?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapItem(rs)) : Optional.empty();
            }
        }
    }

    private QueueItem mapItem(ResultSet rs) throws SQLException {
        return new QueueItem(
                rs.getString("id"),
                rs.getLong("seq"),
                rs.getString("organization_id"),
                rs.getString("agent_id"),
                rs.getString("owner_id"),
                QueueSource.fromString(rs.getString("source")),
                rs.getString("schedule_execution_id"),
                QueueStatus.fromString(rs.getString("status")),
                rs.getInt("priority"),
                rs.getString("payload"),
                rs.getInt("retry_count"),
                rs.getInt("max_retries"),
                rs.getString("result"),
                rs.getString("last_error"),
                rs.getString("claimed_by"),
                rs.getLong("available_at_ms"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private void fire(String id, QueueStatus status) {
        for (TransitionListener listener : listeners) {
            try {
                listener.onTransition(id, status);
            } catch (RuntimeException e) {
                log.error("Queue transition listener failed for {} -> {}", id, status, e);
            }
        }
    }

    private static void validate(EnqueueRequest req) {
        if (req == null) {
            throw new ValidationException("enqueue request is required");
        }
        if (req.agentId() == null || req.agentId().isBlank()) {
            throw new ValidationException("agent_id is required");
        }
        if (req.ownerId() == null || req.ownerId().isBlank()) {
            throw new ValidationException("owner_id is required");
        }
        if (req.organizationId() == null || req.organizationId().isBlank()) {
            throw new ValidationException("organization_id is required");
        }
        if (req.priority() < 1) {
            throw new ValidationException("priority must be >= 1");
        }
        if (req.maxRetries() < 0) {
            throw new ValidationException("max_retries must be >= 0");
        }
    }

    public interface TransitionListener {
        void onTransition(String itemId, QueueStatus status);
    }

    public record EnqueueRequest(
            String organizationId,
            String agentId,
            String ownerId,
            int priority,
            String payload,
            int maxRetries,
            QueueSource source,
            String scheduleExecutionId
    ) {
        public EnqueueRequest {
            source = source == null ? QueueSource.MANUAL : source;
        }
    }

    public record QueueItemStatus(String id, QueueStatus status, String result, String lastError, int retryCount, int maxRetries) {
    }

    public enum FailureOutcome { RETRY_SCHEDULED, FAILED, NOT_ACTIVE }

    public record FailureResolution(FailureOutcome outcome, int retryCount, int maxRetries, QueueStatus observedStatus) {
        public static FailureResolution retryScheduled(int retryCount, int maxRetries) {
            return new FailureResolution(FailureOutcome.RETRY_SCHEDULED, retryCount, maxRetries, QueueStatus.PENDING);
        }

        public static FailureResolution failed(int retryCount, int maxRetries) {
            return new FailureResolution(FailureOutcome.FAILED, retryCount, maxRetries, QueueStatus.FAILED);
        }

        public static FailureResolution notActive(QueueStatus observed) {
            return new FailureResolution(FailureOutcome.NOT_ACTIVE, 0, 0, observed);
        }
    }
}
