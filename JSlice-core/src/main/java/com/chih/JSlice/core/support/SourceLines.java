package com.chih.JSlice.core.support;

import com.chih.JSlice.core.domain.LinePosition;

import java.util.Arrays;

/**
 * 换行符索引：把字符偏移换算为行号 / 行内位置
 * <p>
 * 构建时扫描一次换行符位置，查询时二分查找，适合对同一段文本反复定位。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public final class SourceLines {

    private final int[] newlineOffsets;

    private SourceLines(int[] newlineOffsets) {
        this.newlineOffsets = newlineOffsets;
    }

    public static SourceLines of(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        int[] offsets = new int[count];
        int idx = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                offsets[idx++] = i;
            }
        }
        return new SourceLines(offsets);
    }

    /**
     * 一次性定位，不缓存索引
     */
    public static LinePosition positionIn(String text, int charPos) {
        return of(text).positionOf(charPos);
    }

    /**
     * @param charPos 字符偏移（从 0 开始）
     * @return 行号、行内位置（均从 1 开始）；位于换行符上的偏移算作该行的最后一个字符
     */
    public LinePosition positionOf(int charPos) {
        if (charPos < 0) {
            throw new IllegalArgumentException("Negative char position: " + charPos);
        }
        // 严格位于 charPos 之前的换行符数量
        int before = lowerBound(charPos);
        if (before == 0) {
            return new LinePosition(1, charPos + 1);
        }
        return new LinePosition(before + 1, charPos - newlineOffsets[before - 1]);
    }

    public int lineCount() {
        return newlineOffsets.length + 1;
    }

    public int[] newlineOffsets() {
        return newlineOffsets.clone();
    }

    private int lowerBound(int value) {
        int idx = Arrays.binarySearch(newlineOffsets, value);
        return idx >= 0 ? idx : -(idx + 1);
    }
}
