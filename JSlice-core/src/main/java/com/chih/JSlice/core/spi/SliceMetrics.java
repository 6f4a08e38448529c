package com.chih.JSlice.core.spi;

/**
 * 监控指标 SPI 接口
 *
 * @author lizhiyuan
 */
public interface SliceMetrics {

    /**
     * 记录一次模板渲染 + 对齐
     *
     * @param fileName 文件名
     * @param durationNs 耗时 (纳秒)
     * @param success 是否成功
     */
    void recordSlice(String fileName, long durationNs, boolean success);
}
