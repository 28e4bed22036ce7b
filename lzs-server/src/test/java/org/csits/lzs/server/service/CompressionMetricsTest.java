package org.csits.lzs.server.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.csits.lzs.server.dto.SessionStatistics;
import org.junit.jupiter.api.Test;

class CompressionMetricsTest {

    private static SessionStatistics stats(String target, long in, long out) {
        SessionStatistics stats = new SessionStatistics();
        stats.setTarget(target);
        stats.setBytesIn(in);
        stats.setBytesOut(out);
        return stats;
    }

    @Test
    void recordSession_calculatesRatioAndGroupsByTarget() {
        CompressionMetrics metrics = new CompressionMetrics();

        metrics.recordSession(stats("/a", 1000, 250));
        metrics.recordSession(stats("/a", 100, 100));
        metrics.recordSession(stats("/b", 10, 0));

        assertThat(metrics.getSessions("/a")).hasSize(2);
        assertThat(metrics.getSessions("/a").get(0).getCompressionRatio()).isEqualTo(0.25);
        assertThat(metrics.getSessions("/b").get(0).getCompressionRatio()).isNull();
        assertThat(metrics.totalBytesIn()).isEqualTo(1110);
        assertThat(metrics.totalBytesOut()).isEqualTo(350);

        metrics.clear("/a");
        assertThat(metrics.getSessions("/a")).isEmpty();
    }
}
