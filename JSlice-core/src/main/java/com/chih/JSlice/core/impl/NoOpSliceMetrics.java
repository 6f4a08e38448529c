package com.chih.JSlice.core.impl;

import com.chih.JSlice.core.spi.SliceMetrics;

public class NoOpSliceMetrics implements SliceMetrics {
    @Override
    public void recordSlice(String fileName, long durationNs, boolean success) {
        // Do nothing
    }
}
