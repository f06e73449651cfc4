package io.agentflow.storage;

import io.agentflow.error.InfrastructureException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Manual start/stop state of agents.
 */
public final class AgentStateStore {
    private final Database database;

    public AgentStateStore(Database database) {
        this.database = database;
    }

    public void markStarted(String agentId, String ownerId, boolean autoSchedule, int intervalMinutes, String scheduleId, long nowMs) {
        String sql = """
                INSERT INTO agent_runtime_state(agent_id,owner_id,is_running,auto_schedule,schedule_interval_minutes,schedule_id,last_started_at_ms,updated_at_ms)
                VALUES(?,?,1,?,?,?,?,?)
                ON CONFLICT(agent_id) DO UPDATE SET owner_id=excluded.owner_id,is_running=1,auto_schedule=excluded.auto_schedule,
                    schedule_interval_minutes=excluded.schedule_interval_minutes,schedule_id=excluded.schedule_id,
                    last_started_at_ms=excluded.last_started_at_ms,updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, agentId);
            ps.setString(2, ownerId);
            ps.setInt(3, autoSchedule ? 1 : 0);
            ps.setInt(4, intervalMinutes);
            ps.setString(5, scheduleId);
            ps.setLong(6, nowMs);
            ps.setLong(7, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to mark agent started " + agentId, e);
        }
    }

    public void markStopped(String agentId, String ownerId, long nowMs) {
        String sql = """
                INSERT INTO agent_runtime_state(agent_id,owner_id,is_running,last_stopped_at_ms,updated_at_ms)
                VALUES(?,?,0,?,?)
                ON CONFLICT(agent_id) DO UPDATE SET is_running=0,last_stopped_at_ms=excluded.last_stopped_at_ms,updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, agentId);
            ps.setString(2, ownerId);
            ps.setLong(3, nowMs);
            ps.setLong(4, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to mark agent stopped " + agentId, e);
        }
    }

    public Optional<AgentState> find(String agentId) {
        String sql = "SELECT agent_id,owner_id,is_running,auto_schedule,schedule_interval_minutes,schedule_id,last_started_at_ms,last_stopped_at_ms "
                + "FROM agent_runtime_state WHERE agent_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, agentId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                long started = rs.getLong("last_started_at_ms");
                Long startedAt = rs.wasNull() ? null : started;
                long stopped = rs.getLong("last_stopped_at_ms");
                Long stoppedAt = rs.wasNull() ? null : stopped;
                return Optional.of(new AgentState(
                        rs.getString("agent_id"),
                        rs.getString("owner_id"),
                        rs.getInt("is_running") == 1,
                        rs.getInt("auto_schedule") == 1,
                        rs.getInt("schedule_interval_minutes"),
                        rs.getString("schedule_id"),
                        startedAt,
                        stoppedAt
                ));
            }
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to read agent state " + agentId, e);
        }
    }

    /**
     * An agent with no recorded state has never been stopped and is dispatchable.
     */
    public boolean isStopped(String agentId) {
        return find(agentId).map(s -> !s.running()).orElse(false);
    }

    public record AgentState(
            String agentId,
            String ownerId,
            boolean running,
            boolean autoSchedule,
            int scheduleIntervalMinutes,
            String scheduleId,
            Long lastStartedAtMs,
            Long lastStoppedAtMs
    ) {
    }
}
