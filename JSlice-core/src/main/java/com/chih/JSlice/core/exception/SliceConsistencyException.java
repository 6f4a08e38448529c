package com.chih.JSlice.core.exception;

/**
 * 映射切片不满足连续覆盖约束
 */
public class SliceConsistencyException extends JSliceException {
    public SliceConsistencyException(String fileName, String detail) {
        super("Inconsistent slicing for file " + fileName + ": " + detail);
    }
}
