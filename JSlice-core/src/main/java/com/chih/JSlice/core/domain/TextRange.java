package com.chih.JSlice.core.domain;

/**
 * 半开区间 [start, end)
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public record TextRange(int start, int end) {

    public TextRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
        }
    }

    public static TextRange of(int start, int end) {
        return new TextRange(start, end);
    }

    /**
     * 零宽区间
     */
    public static TextRange point(int position) {
        return new TextRange(position, position);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * 位置是否落在区间内（不含 end）
     */
    public boolean contains(int position) {
        return position >= start && position < end;
    }

    public String slice(String text) {
        return text.substring(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
