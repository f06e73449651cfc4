package io.agentflow.observability;

import io.agentflow.runtime.OrganizationRuntime;

import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(MetricsCollector.DashboardMetrics dashboard,
                                List<OrganizationRuntime.RuntimeStatusView> runtimes,
                                Map<String, Integer> queueStatus,
                                int claimConflicts) {
        StringBuilder sb = new StringBuilder();
        appendMapGauge(sb, "agentflow_queue_items", "Queue items grouped by status", "status", queueStatus);
        appendGauge(sb, "agentflow_queue_depth", "Pending queue items across organizations", null, null, dashboard.currentQueueDepth());
        appendGauge(sb, "agentflow_claim_conflict_total", "Claims lost to a concurrent worker", null, null, claimConflicts);
        appendGauge(sb, "agentflow_executions_total", "Executions recorded since start", null, null, dashboard.totalExecutions());
        appendGauge(sb, "agentflow_execution_errors_total", "Failed executions recorded since start", null, null, dashboard.totalErrors());
        appendGauge(sb, "agentflow_active_runtimes", "Organization runtimes in ACTIVE status", null, null, dashboard.activeRuntimes());
        appendDecimal(sb, "agentflow_error_rate_percent", "Error rate over the last hour", null, null, dashboard.overallErrorRate());
        appendDecimal(sb, "agentflow_execution_time_avg_ms", "Mean execution time over the last hour", null, null, dashboard.avgExecutionTimeMs());
        appendDecimal(sb, "agentflow_container_utilization_percent", "Running executions against concurrency capacity", null, null,
                dashboard.containerUtilization());
        for (OrganizationRuntime.RuntimeStatusView runtime : runtimes) {
            String org = runtime.organizationId();
            appendGauge(sb, "agentflow_runtime_memory_used_mb", "Pool memory allocated per organization", "organization", org,
                    runtime.memoryUsageMb());
            appendGauge(sb, "agentflow_runtime_memory_limit_mb", "Pool memory ceiling per organization", "organization", org,
                    runtime.memoryLimitMb());
            appendGauge(sb, "agentflow_runtime_running_executions", "Executions in flight per organization", "organization", org,
                    runtime.runningExecutions());
            appendGauge(sb, "agentflow_runtime_containers", "Non-stopped containers per organization", "organization", org,
                    runtime.activeContainers());
            appendDecimal(sb, "agentflow_runtime_health_score", "Mean container health per organization", "organization", org,
                    runtime.healthScore());
        }
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Integer> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Integer> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        appendSample(sb, metric, help, label, labelValue, Long.toString(value));
    }

    private static void appendDecimal(StringBuilder sb, String metric, String help, String label, String labelValue, double value) {
        appendSample(sb, metric, help, label, labelValue, String.format(Locale.ROOT, "%.2f", value));
    }

    private static void appendSample(StringBuilder sb, String metric, String help, String label, String labelValue, String value) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
