package com.chih.JSlice.core.slice;

import com.chih.JSlice.core.domain.MappingSlice;
import com.chih.JSlice.core.domain.RawSpan;
import com.chih.JSlice.core.domain.SpanKind;
import com.chih.JSlice.core.domain.TextRange;

import java.util.ArrayList;
import java.util.List;

/**
 * 对齐过程中的中间片段，只在引擎内部流转
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
final class IntermediateFragment {

    enum Resolution {
        /** 源码与渲染一一对应，已确定 */
        INVARIANT,
        /** 多个片段，对应关系待解析 */
        COMPOUND,
        /** 单个片段 */
        SIMPLE
    }

    private final Resolution resolution;
    private final TextRange sourceRange;
    private final TextRange renderedRange;
    private final List<RawSpan> spans;

    IntermediateFragment(Resolution resolution, TextRange sourceRange, TextRange renderedRange, List<RawSpan> spans) {
        this.resolution = resolution;
        this.sourceRange = sourceRange;
        this.renderedRange = renderedRange;
        this.spans = List.copyOf(spans);
    }

    static IntermediateFragment invariant(RawSpan span, int renderedStart) {
        return new IntermediateFragment(Resolution.INVARIANT, span.sourceRange(),
                new TextRange(renderedStart, renderedStart + span.getText().length()), List.of(span));
    }

    /**
     * 多于一个片段时为 COMPOUND，否则为 SIMPLE
     */
    static IntermediateFragment compound(TextRange sourceRange, TextRange renderedRange, List<RawSpan> spans) {
        Resolution resolution = spans.size() == 1 ? Resolution.SIMPLE : Resolution.COMPOUND;
        return new IntermediateFragment(resolution, sourceRange, renderedRange, spans);
    }

    /**
     * 没有任何源码与之对应的渲染文本
     */
    static IntermediateFragment gap(int sourcePos, TextRange renderedRange) {
        return new IntermediateFragment(Resolution.COMPOUND, TextRange.point(sourcePos), renderedRange, List.of());
    }

    Resolution resolution() {
        return resolution;
    }

    TextRange sourceRange() {
        return sourceRange;
    }

    TextRange renderedRange() {
        return renderedRange;
    }

    List<RawSpan> spans() {
        return spans;
    }

    /**
     * 渲染宽度为零：每个片段各自映射为零宽切片
     */
    List<MappingSlice> pointSlices() {
        List<MappingSlice> result = new ArrayList<>(spans.size());
        for (RawSpan span : spans) {
            result.add(new MappingSlice(pointKind(span), span.sourceRange(), TextRange.point(renderedRange.start())));
        }
        return result;
    }

    /**
     * 单片段直接映射
     */
    MappingSlice simpleSlice(String rendered) {
        RawSpan span = spans.get(0);
        if (renderedRange.isEmpty()) {
            return new MappingSlice(pointKind(span), span.sourceRange(), renderedRange);
        }
        SpanKind kind = switch (span.getKind()) {
            case LITERAL -> renderedRange.slice(rendered).equals(span.getText()) ? SpanKind.LITERAL : SpanKind.TEMPLATED;
            case ESCAPED -> SpanKind.ESCAPED;
            default -> SpanKind.TEMPLATED;
        };
        return new MappingSlice(kind, span.sourceRange(), renderedRange);
    }

    static SpanKind pointKind(RawSpan span) {
        return span.isSourceOnly() || span.getKind() == SpanKind.TEMPLATED ? span.getKind() : SpanKind.TEMPLATED;
    }

    /**
     * 合并后的切片类型：含模板 / 块 / 注释即为 TEMPLATED，其次 ESCAPED，
     * 只有字面量且与渲染文本逐字一致时才是 LITERAL
     */
    static SpanKind coalescedKind(List<RawSpan> spans, String renderedPart) {
        boolean escaped = false;
        StringBuilder raw = new StringBuilder();
        for (RawSpan span : spans) {
            switch (span.getKind()) {
                case LITERAL -> raw.append(span.getText());
                case ESCAPED -> escaped = true;
                default -> {
                    return SpanKind.TEMPLATED;
                }
            }
        }
        if (escaped) {
            return SpanKind.ESCAPED;
        }
        return raw.toString().equals(renderedPart) ? SpanKind.LITERAL : SpanKind.TEMPLATED;
    }

    @Override
    public String toString() {
        return resolution + " source" + sourceRange + " rendered" + renderedRange + " " + spans;
    }
}
