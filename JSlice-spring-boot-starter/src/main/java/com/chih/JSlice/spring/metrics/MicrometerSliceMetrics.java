package com.chih.JSlice.spring.metrics;

import com.chih.JSlice.core.spi.SliceMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * 基于 Micrometer 的监控实现
 * <p>
 * 监控指标说明：
 * <ul>
 *   <li>jslice.slice.timer: 渲染 + 对齐耗时，tags: file={fileName}, result={success|failure}</li>
 *   <li>jslice.slice.count: 处理次数，tags 同上</li>
 * </ul>
 * </p>
 * <p>
 * 文件名直接作为 tag 值，文件数量很多（例如按请求生成的临时名称）时注意指标基数。
 * </p>
 */
public class MicrometerSliceMetrics implements SliceMetrics {

    private final MeterRegistry registry;

    public MicrometerSliceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordSlice(String fileName, long durationNs, boolean success) {
        String file = fileName == null ? "<string>" : fileName;
        String result = success ? "success" : "failure";

        Timer.builder("jslice.slice.timer")
                .description("Timer for template rendering and slicing")
                .tag("file", file)
                .tag("result", result)
                .register(registry)
                .record(durationNs, TimeUnit.NANOSECONDS);

        Counter.builder("jslice.slice.count")
                .description("Counter for template rendering and slicing")
                .tag("file", file)
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
