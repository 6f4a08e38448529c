package com.chih.JSlice.core.slice;

import com.chih.JSlice.core.domain.MappingSlice;
import com.chih.JSlice.core.domain.RawSpan;
import com.chih.JSlice.core.domain.TemplatedFile;

import java.util.List;

/**
 * 对齐结果
 *
 * @param renderedText 渲染文本（若剥离了外层包裹，则为剥离后的文本）
 * @param slices 连续覆盖源码与渲染文本的映射切片
 * @param rawSpans 对齐前的词法片段
 * @author lizhiyuan
 * @since 2026/10/13
 */
public record SliceAlignment(String renderedText, List<MappingSlice> slices, List<RawSpan> rawSpans) {

    public SliceAlignment {
        slices = List.copyOf(slices);
        rawSpans = List.copyOf(rawSpans);
    }

    public TemplatedFile toTemplatedFile(String sourceText, String fileName) {
        return new TemplatedFile(sourceText, fileName, renderedText, rawSpans, slices);
    }
}
