package io.archivemirror.observability;

import io.archivemirror.agent.HealthSnapshot;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

final class PrometheusFormatterTest {

    @Test
    void originExpositionListsStatusesAndTotals() {
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        byStatus.put("online", 2);
        byStatus.put("pending", 1);
        String text = PrometheusFormatter.formatOrigin(new PrometheusFormatter.OriginStats(
                byStatus, 7L, 4L, 1L, Map.of("push", 9L)));

        Assertions.assertTrue(text.contains("# TYPE archivemirror_mirrors_total gauge\n"));
        Assertions.assertTrue(text.contains("archivemirror_mirrors_total{status=\"online\"} 2\n"));
        Assertions.assertTrue(text.contains("archivemirror_mirrors_total{status=\"pending\"} 1\n"));
        Assertions.assertTrue(text.contains("archivemirror_verified_copies_total 7\n"));
        Assertions.assertTrue(text.contains("archivemirror_sync_log_total{action=\"push\"} 9\n"));
    }

    @Test
    void mirrorExpositionReflectsHealth() {
        HealthSnapshot health = new HealthSnapshot("ok", "attic", true, "mir_1", 3, 300L, 10, 1, 5L, 1L, 0L);
        String text = PrometheusFormatter.formatMirror(health, Map.of("verify-fail", 2L));

        Assertions.assertTrue(text.contains("archivemirror_agent_paired 1\n"));
        Assertions.assertTrue(text.contains("archivemirror_agent_files 3\n"));
        Assertions.assertTrue(text.contains("archivemirror_agent_rate_limit_bytes 0\n"));
        Assertions.assertTrue(text.contains("archivemirror_agent_sync_outcomes_total{action=\"verify-fail\"} 2\n"));
    }
}
