package com.chih.JSlice.spring.metrics;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Micrometer 监控测试")
class MicrometerSliceMetricsTest {

    @Test
    @DisplayName("按文件与结果记录耗时和次数")
    void testRecordSlice() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MicrometerSliceMetrics metrics = new MicrometerSliceMetrics(registry);

        metrics.recordSlice("a.sql", TimeUnit.MILLISECONDS.toNanos(5), true);
        metrics.recordSlice("a.sql", TimeUnit.MILLISECONDS.toNanos(7), true);
        metrics.recordSlice("a.sql", TimeUnit.MILLISECONDS.toNanos(1), false);

        Timer success = registry.get("jslice.slice.timer").tags("file", "a.sql", "result", "success").timer();
        assertThat(success.count()).isEqualTo(2);
        assertThat(success.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(12.0);
        assertThat(registry.get("jslice.slice.count").tags("file", "a.sql", "result", "failure").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("文件名为空时使用占位名称")
    void testNullFileName() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        new MicrometerSliceMetrics(registry).recordSlice(null, 10, true);

        assertThat(registry.get("jslice.slice.count").tag("file", "<string>").counter().count()).isEqualTo(1.0);
    }
}
