package io.agentflow.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.agentflow.error.InfrastructureException;
import io.agentflow.model.NotificationPreferences;
import io.agentflow.model.Schedule;
import io.agentflow.model.ScheduleConfig;
import io.agentflow.model.ScheduleType;
import io.agentflow.model.ScheduledExecution;
import io.agentflow.model.ScheduledExecutionStatus;
import io.agentflow.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ScheduleStore {
    private static final String SCHEDULE_COLUMNS = "id,agent_id,owner_id,schedule_type,interval_minutes,cron_expression,webhook_endpoint,"
            + "timezone,enabled,max_executions_per_day,retry_on_failure,notification_preferences,created_at_ms,updated_at_ms";
    private static final String EXECUTION_COLUMNS = "id,schedule_id,agent_id,owner_id,scheduled_for_ms,status,queue_item_id,"
            + "execution_result,execution_time_ms,error_message,started_at_ms,completed_at_ms";

    private final Database database;

    public ScheduleStore(Database database) {
        this.database = database;
    }

    public void insertSchedule(Schedule schedule) {
        String sql = "INSERT INTO schedules(" + SCHEDULE_COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ScheduleConfig cfg = schedule.config();
            ps.setString(1, schedule.id());
            ps.setString(2, cfg.agentId());
            ps.setString(3, cfg.ownerId());
            bindConfig(ps, 4, cfg);
            ps.setLong(13, schedule.createdAtMs());
            ps.setLong(14, schedule.updatedAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to insert schedule " + schedule.id(), e);
        }
    }

    public boolean updateSchedule(Schedule schedule) {
        String sql = "UPDATE schedules SET schedule_type=?,interval_minutes=?,cron_expression=?,webhook_endpoint=?,timezone=?,enabled=?,"
                + "max_executions_per_day=?,retry_on_failure=?,notification_preferences=?,updated_at_ms=? WHERE id=? AND owner_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ScheduleConfig cfg = schedule.config();
            bindConfig(ps, 1, cfg);
            ps.setLong(10, schedule.updatedAtMs());
            ps.setString(11, schedule.id());
            ps.setString(12, cfg.ownerId());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to update schedule " + schedule.id(), e);
        }
    }

    public Optional<Schedule> findSchedule(String scheduleId) {
        return querySchedule("SELECT " + SCHEDULE_COLUMNS + " FROM schedules WHERE id=?", scheduleId, null);
    }

    public Optional<Schedule> findScheduleForOwner(String scheduleId, String ownerId) {
        return querySchedule("SELECT " + SCHEDULE_COLUMNS + " FROM schedules WHERE id=? AND owner_id=?", scheduleId, ownerId);
    }

    public List<Schedule> listSchedulesForAgent(String agentId) {
        List<Schedule> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + SCHEDULE_COLUMNS + " FROM schedules WHERE agent_id=? ORDER BY created_at_ms")) {
            ps.setString(1, agentId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapSchedule(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to list schedules for agent " + agentId, e);
        }
    }

    public void insertExecutions(List<ScheduledExecution> executions, long nowMs) {
        if (executions.isEmpty()) {
            return;
        }
        String sql = "INSERT INTO scheduled_executions(id,schedule_id,agent_id,owner_id,scheduled_for_ms,status,created_at_ms,updated_at_ms) "
                + "VALUES(?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (ScheduledExecution e : executions) {
                    ps.setString(1, e.id());
                    ps.setString(2, e.scheduleId());
                    ps.setString(3, e.agentId());
                    ps.setString(4, e.ownerId());
                    ps.setLong(5, e.scheduledForMs());
                    ps.setString(6, e.status().dbValue());
                    ps.setLong(7, nowMs);
                    ps.setLong(8, nowMs);
                    ps.addBatch();
                }
                ps.executeBatch();
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to insert scheduled executions", e);
        }
    }

    /**
     * Scheduled (not yet dispatched) executions of a schedule whose fire time lies in {@code [fromMs, toMs]}.
     */
    public List<ScheduledExecution> listScheduledInWindow(String scheduleId, long fromMs, long toMs) {
        List<ScheduledExecution> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + EXECUTION_COLUMNS + " FROM scheduled_executions "
                     + "WHERE schedule_id=? AND status=? AND scheduled_for_ms>=? AND scheduled_for_ms<=? ORDER BY scheduled_for_ms")) {
            ps.setString(1, scheduleId);
            ps.setString(2, ScheduledExecutionStatus.SCHEDULED.dbValue());
            ps.setLong(3, fromMs);
            ps.setLong(4, toMs);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapExecution(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to list scheduled executions for " + scheduleId, e);
        }
    }

    public List<ScheduledExecution> listExecutions(String scheduleId, ScheduledExecutionStatus status) {
        List<ScheduledExecution> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + EXECUTION_COLUMNS
                     + " FROM scheduled_executions WHERE schedule_id=? AND status=? ORDER BY scheduled_for_ms")) {
            ps.setString(1, scheduleId);
            ps.setString(2, status.dbValue());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapExecution(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to list executions for " + scheduleId, e);
        }
    }

    public Optional<ScheduledExecution> findExecution(String id) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + EXECUTION_COLUMNS + " FROM scheduled_executions WHERE id=?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapExecution(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to read scheduled execution " + id, e);
        }
    }

    /**
     * Marks every still-scheduled execution of the schedule as skipped. Returns the number skipped.
     */
    public int skipScheduled(String scheduleId, long nowMs) {
        String sql = "UPDATE scheduled_executions SET status=?,completed_at_ms=?,updated_at_ms=? WHERE schedule_id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, ScheduledExecutionStatus.SKIPPED.dbValue());
            ps.setLong(2, nowMs);
            ps.setLong(3, nowMs);
            ps.setString(4, scheduleId);
            ps.setString(5, ScheduledExecutionStatus.SCHEDULED.dbValue());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to skip executions for schedule " + scheduleId, e);
        }
    }

    /**
     * Due executions of enabled schedules, oldest first. Executions of stopped agents stay
     * {@code scheduled} and are left out, so they never occupy the batch.
     */
    public List<DueExecution> listDue(long nowMs, int limit) {
        String sql = "SELECT e.id,e.schedule_id,e.agent_id,e.owner_id,e.scheduled_for_ms FROM scheduled_executions e "
                + "JOIN schedules s ON s.id=e.schedule_id "
                + "WHERE e.status=? AND e.scheduled_for_ms<=? AND s.enabled=1 "
                + "AND e.agent_id NOT IN (SELECT agent_id FROM agent_runtime_state WHERE is_running=0) "
                + "ORDER BY e.scheduled_for_ms ASC LIMIT ?";
        List<DueExecution> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, ScheduledExecutionStatus.SCHEDULED.dbValue());
            ps.setLong(2, nowMs);
            ps.setInt(3, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new DueExecution(
                            rs.getString("id"),
                            rs.getString("schedule_id"),
                            rs.getString("agent_id"),
                            rs.getString("owner_id"),
                            rs.getLong("scheduled_for_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to list due scheduled executions", e);
        }
    }

    public boolean markExecuting(String id, long nowMs) {
        String sql = "UPDATE scheduled_executions SET status=?,started_at_ms=?,updated_at_ms=? WHERE id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, ScheduledExecutionStatus.EXECUTING.dbValue());
            ps.setLong(2, nowMs);
            ps.setLong(3, nowMs);
            ps.setString(4, id);
            ps.setString(5, ScheduledExecutionStatus.SCHEDULED.dbValue());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to mark scheduled execution executing " + id, e);
        }
    }

    public void attachQueueItem(String id, String queueItemId, long nowMs) {
        String sql = "UPDATE scheduled_executions SET queue_item_id=?,updated_at_ms=? WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, queueItemId);
            ps.setLong(2, nowMs);
            ps.setString(3, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to attach queue item to " + id, e);
        }
    }

    /**
     * Writes the terminal outcome. Only an executing row can finish, so outcomes never regress.
     */
    public boolean markFinished(String id, boolean success, String executionResult, long executionTimeMs, String errorMessage, long nowMs) {
        String sql = "UPDATE scheduled_executions SET status=?,execution_result=?,execution_time_ms=?,error_message=?,completed_at_ms=?,updated_at_ms=? "
                + "WHERE id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, (success ? ScheduledExecutionStatus.COMPLETED : ScheduledExecutionStatus.FAILED).dbValue());
            ps.setString(2, executionResult);
            ps.setLong(3, executionTimeMs);
            ps.setString(4, errorMessage);
            ps.setLong(5, nowMs);
            ps.setLong(6, nowMs);
            ps.setString(7, id);
            ps.setString(8, ScheduledExecutionStatus.EXECUTING.dbValue());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to finish scheduled execution " + id, e);
        }
    }

    public Map<ScheduledExecutionStatus, Integer> statusCounts(String scheduleId) {
        Map<ScheduledExecutionStatus, Integer> out = new EnumMap<>(ScheduledExecutionStatus.class);
        for (ScheduledExecutionStatus status : ScheduledExecutionStatus.values()) {
            out.put(status, 0);
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT status, COUNT(*) AS n FROM scheduled_executions WHERE schedule_id=? GROUP BY status")) {
            ps.setString(1, scheduleId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(ScheduledExecutionStatus.fromString(rs.getString("status")), rs.getInt("n"));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to count executions for schedule " + scheduleId, e);
        }
    }

    public Optional<Long> nextScheduledRun(String agentId, long afterMs) {
        String sql = "SELECT MIN(e.scheduled_for_ms) FROM scheduled_executions e JOIN schedules s ON s.id=e.schedule_id "
                + "WHERE e.agent_id=? AND e.status=? AND e.scheduled_for_ms>=? AND s.enabled=1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, agentId);
            ps.setString(2, ScheduledExecutionStatus.SCHEDULED.dbValue());
            ps.setLong(3, afterMs);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                long value = rs.getLong(1);
                return rs.wasNull() ? Optional.empty() : Optional.of(value);
            }
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to read next scheduled run for agent " + agentId, e);
        }
    }

    private Optional<Schedule> querySchedule(String sql, String scheduleId, String ownerId) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, scheduleId);
            if (ownerId != null) {
                ps.setString(2, ownerId);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapSchedule(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to read schedule " + scheduleId, e);
        }
    }

    private void bindConfig(PreparedStatement ps, int start, ScheduleConfig cfg) throws SQLException {
        ps.setString(start, cfg.scheduleType().wireName());
        if (cfg.intervalMinutes() == null) {
            ps.setNull(start + 1, Types.INTEGER);
        } else {
            ps.setInt(start + 1, cfg.intervalMinutes());
        }
        ps.setString(start + 2, cfg.cronExpression());
        ps.setString(start + 3, cfg.webhookEndpoint());
        ps.setString(start + 4, cfg.timezone() == null || cfg.timezone().isBlank() ? "UTC" : cfg.timezone());
        ps.setInt(start + 5, cfg.enabled() ? 1 : 0);
        ps.setInt(start + 6, cfg.maxExecutionsPerDay());
        ps.setInt(start + 7, cfg.retryOnFailure() ? 1 : 0);
        ps.setString(start + 8, Jsons.toCompactJson(cfg.notificationPreferences()));
    }

    private Schedule mapSchedule(ResultSet rs) throws SQLException {
        int interval = rs.getInt("interval_minutes");
        Integer intervalMinutes = rs.wasNull() ? null : interval;
        ScheduleConfig cfg = new ScheduleConfig(
                rs.getString("agent_id"),
                rs.getString("owner_id"),
                ScheduleType.fromString(rs.getString("schedule_type")),
                intervalMinutes,
                rs.getString("cron_expression"),
                rs.getString("webhook_endpoint"),
                rs.getString("timezone"),
                rs.getInt("enabled") == 1,
                rs.getInt("max_executions_per_day"),
                rs.getInt("retry_on_failure") == 1,
                readPreferences(rs.getString("notification_preferences"))
        );
        return new Schedule(rs.getString("id"), cfg, rs.getLong("created_at_ms"), rs.getLong("updated_at_ms"));
    }

    private NotificationPreferences readPreferences(String raw) {
        if (raw == null || raw.isBlank() || "{}".equals(raw.trim())) {
            return NotificationPreferences.defaults();
        }
        try {
            return Jsons.mapper().readValue(raw, NotificationPreferences.class);
        } catch (JsonProcessingException e) {
            throw new InfrastructureException("Corrupt notification preferences: " + raw, e);
        }
    }

    private ScheduledExecution mapExecution(ResultSet rs) throws SQLException {
        return new ScheduledExecution(
                rs.getString("id"),
                rs.getString("schedule_id"),
                rs.getString("agent_id"),
                rs.getString("owner_id"),
                rs.getLong("scheduled_for_ms"),
                ScheduledExecutionStatus.fromString(rs.getString("status")),
                rs.getString("queue_item_id"),
                rs.getString("execution_result"),
                nullableLong(rs, "execution_time_ms"),
                rs.getString("error_message"),
                nullableLong(rs, "started_at_ms"),
                nullableLong(rs, "completed_at_ms")
        );
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    public record DueExecution(String id, String scheduleId, String agentId, String ownerId, long scheduledForMs) {
    }
}
