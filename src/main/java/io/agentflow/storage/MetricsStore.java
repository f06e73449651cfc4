package io.agentflow.storage;

import io.agentflow.error.InfrastructureException;
import io.agentflow.model.MetricSnapshot;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

public final class MetricsStore {
    private final Database database;

    public MetricsStore(Database database) {
        this.database = database;
    }

    public void insertSnapshot(String organizationId, MetricSnapshot s) {
        String sql = "INSERT INTO runtime_metrics(runtime_id,organization_id,captured_at_ms,execution_count,error_count,avg_response_time_ms,"
                + "memory_usage_mb,active_containers,executions_per_minute,success_rate,error_rate,health_score) VALUES(?,?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, s.runtimeId());
            ps.setString(2, organizationId);
            ps.setLong(3, s.timestampMs());
            ps.setInt(4, s.executionCount());
            ps.setInt(5, s.errorCount());
            ps.setDouble(6, s.avgResponseTimeMs());
            ps.setDouble(7, s.memoryUsageMb());
            ps.setInt(8, s.activeContainers());
            ps.setInt(9, s.executionsPerMinute());
            ps.setDouble(10, s.successRate());
            ps.setDouble(11, s.errorRate());
            ps.setDouble(12, s.healthScore());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to persist metrics snapshot for " + s.runtimeId(), e);
        }
    }

    public List<MetricSnapshot> history(String runtimeId, long startMs, long endMs) {
        String sql = "SELECT runtime_id,captured_at_ms,execution_count,error_count,avg_response_time_ms,memory_usage_mb,active_containers,"
                + "executions_per_minute,success_rate,error_rate,health_score FROM runtime_metrics "
                + "WHERE runtime_id=? AND captured_at_ms>=? AND captured_at_ms<=? ORDER BY captured_at_ms ASC, id ASC";
        List<MetricSnapshot> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runtimeId);
            ps.setLong(2, startMs);
            ps.setLong(3, endMs);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new MetricSnapshot(
                            rs.getString("runtime_id"),
                            rs.getLong("captured_at_ms"),
                            rs.getInt("execution_count"),
                            rs.getInt("error_count"),
                            rs.getDouble("avg_response_time_ms"),
                            rs.getDouble("memory_usage_mb"),
                            rs.getInt("active_containers"),
                            rs.getInt("executions_per_minute"),
                            rs.getDouble("success_rate"),
                            rs.getDouble("error_rate"),
                            rs.getDouble("health_score")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to read metrics history for " + runtimeId, e);
        }
    }
}
