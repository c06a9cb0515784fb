package io.archivemirror.observability;

import io.archivemirror.agent.HealthSnapshot;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String formatOrigin(OriginStats stats) {
        StringBuilder sb = new StringBuilder();
        appendMapGauge(sb, "archivemirror_mirrors_total", "Registered mirrors grouped by status", "status", stats.mirrorsByStatus());
        appendGauge(sb, "archivemirror_verified_copies_total", "Verified mirror copies across all mirrors", null, null, stats.verifiedCopies());
        appendGauge(sb, "archivemirror_catalog_approved_total", "Approved catalog entries eligible for mirroring", null, null, stats.approvedEntries());
        appendGauge(sb, "archivemirror_pairing_codes_outstanding", "Unexpired, unconsumed pairing codes", null, null, stats.outstandingCodes());
        appendMapGauge(sb, "archivemirror_sync_log_total", "Sync log entries grouped by action", "action", stats.syncLogByAction());
        return sb.toString();
    }

    public static String formatMirror(HealthSnapshot health, Map<String, ? extends Number> outcomes) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "archivemirror_agent_paired", "Whether this mirror holds a credential (1=yes,0=no)", null, null, health.paired() ? 1 : 0);
        appendGauge(sb, "archivemirror_agent_files", "Verified files held locally", null, null, health.fileCount());
        appendGauge(sb, "archivemirror_agent_bytes", "Bytes held in verified files", null, null, health.totalBytes());
        appendGauge(sb, "archivemirror_agent_capacity", "Configured maximum file count", null, null, health.capacity());
        appendGauge(sb, "archivemirror_agent_active_downloads", "Downloads currently streaming", null, null, health.activeDownloads());
        appendGauge(sb, "archivemirror_agent_served_downloads_total", "Downloads completed since start", null, null, health.servedDownloads());
        appendGauge(sb, "archivemirror_agent_rate_limit_bytes", "Per-connection download cap in bytes per second (0=unlimited)", null, null, health.downloadBytesPerSecond());
        appendMapGauge(sb, "archivemirror_agent_sync_outcomes_total", "Sync item outcomes since start grouped by action", "action", outcomes);
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, ? extends Number> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, ? extends Number> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue().longValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
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

    public record OriginStats(
            Map<String, Integer> mirrorsByStatus,
            long verifiedCopies,
            long approvedEntries,
            long outstandingCodes,
            Map<String, Long> syncLogByAction
    ) {
    }
}
