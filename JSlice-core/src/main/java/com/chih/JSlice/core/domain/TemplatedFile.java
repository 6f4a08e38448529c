package com.chih.JSlice.core.domain;

import com.chih.JSlice.core.exception.SliceConsistencyException;
import com.chih.JSlice.core.support.SourceLines;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 模板文件的渲染结果及其源码映射
 * <p>
 * 持有原始文本、渲染文本、词法片段与映射切片，并提供渲染位置到源码位置的换算。
 * 构造时校验映射切片在两条坐标轴上都连续、完整覆盖，不满足时抛出
 * {@link SliceConsistencyException}。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
@JsonPropertyOrder({"fileName", "sourceText", "renderedText", "rawSpans", "slices"})
public class TemplatedFile {

    private final String sourceText;
    private final String fileName;
    private final String renderedText;
    private final List<RawSpan> rawSpans;
    private final List<MappingSlice> slices;

    @JsonIgnore
    private final SourceLines sourceLines;
    @JsonIgnore
    private final SourceLines renderedLines;

    public TemplatedFile(String sourceText, String fileName, String renderedText,
                         List<RawSpan> rawSpans, List<MappingSlice> slices) {
        this.sourceText = Objects.requireNonNull(sourceText, "sourceText");
        this.fileName = fileName == null ? "<string>" : fileName;
        this.renderedText = Objects.requireNonNull(renderedText, "renderedText");
        this.rawSpans = List.copyOf(rawSpans);
        this.slices = List.copyOf(slices);
        checkConsistency();
        this.sourceLines = SourceLines.of(sourceText);
        this.renderedLines = SourceLines.of(renderedText);
    }

    /**
     * 未经模板处理的文件：整段文本就是一条字面量映射
     */
    public static TemplatedFile fromString(String raw, String fileName) {
        if (raw.isEmpty()) {
            return new TemplatedFile(raw, fileName, raw, List.of(), List.of());
        }
        return new TemplatedFile(raw, fileName, raw,
                List.of(new RawSpan(raw, SpanKind.LITERAL, 0)),
                List.of(MappingSlice.of(SpanKind.LITERAL, 0, raw.length(), 0, raw.length())));
    }

    private void checkConsistency() {
        int cursor = 0;
        for (RawSpan span : rawSpans) {
            if (span.getSourceOffset() != cursor) {
                throw new SliceConsistencyException(fileName,
                        "raw span " + span + " does not start at " + cursor);
            }
            cursor = span.getEnd();
        }
        if (!rawSpans.isEmpty() && cursor != sourceText.length()) {
            throw new SliceConsistencyException(fileName,
                    "raw spans end at " + cursor + " but source length is " + sourceText.length());
        }

        if (slices.isEmpty()) {
            if (!sourceText.isEmpty() || !renderedText.isEmpty()) {
                throw new SliceConsistencyException(fileName, "no slices for non-empty file");
            }
            return;
        }
        int sourceCursor = 0;
        int renderedCursor = 0;
        for (MappingSlice slice : slices) {
            if (slice.getSourceRange().start() != sourceCursor) {
                throw new SliceConsistencyException(fileName,
                        "slice " + slice + " breaks source contiguity at " + sourceCursor);
            }
            if (slice.getRenderedRange().start() != renderedCursor) {
                throw new SliceConsistencyException(fileName,
                        "slice " + slice + " breaks rendered contiguity at " + renderedCursor);
            }
            if (slice.getKind().isBlock() && !slice.getRenderedRange().isEmpty()) {
                throw new SliceConsistencyException(fileName, "block slice " + slice + " has rendered width");
            }
            sourceCursor = slice.getSourceRange().end();
            renderedCursor = slice.getRenderedRange().end();
        }
        if (sourceCursor != sourceText.length()) {
            throw new SliceConsistencyException(fileName,
                    "slices end at source " + sourceCursor + " but source length is " + sourceText.length());
        }
        if (renderedCursor != renderedText.length()) {
            throw new SliceConsistencyException(fileName,
                    "slices end at rendered " + renderedCursor + " but rendered length is " + renderedText.length());
        }
        RawSpan unmapped = firstUnmappedBlock(rawSpans, slices);
        if (unmapped != null) {
            throw new SliceConsistencyException(fileName,
                    "block span " + unmapped + " has no zero-width slice of its own");
        }
    }

    /**
     * 找出第一个没有独立零宽切片的块标记
     * <p>
     * 每个块标记都必须对应一条源码区间与之完全相同、渲染区间为空的切片。
     * </p>
     *
     * @return 不满足条件的块标记，全部满足时返回 null
     */
    public static RawSpan firstUnmappedBlock(List<RawSpan> rawSpans, List<MappingSlice> slices) {
        Set<TextRange> zeroWidth = new HashSet<>();
        for (MappingSlice slice : slices) {
            if (slice.getRenderedRange().isEmpty()) {
                zeroWidth.add(slice.getSourceRange());
            }
        }
        for (RawSpan span : rawSpans) {
            if (span.getKind().isBlock() && !zeroWidth.contains(span.sourceRange())) {
                return span;
            }
        }
        return null;
    }

    public String getSourceText() {
        return sourceText;
    }

    public String getFileName() {
        return fileName;
    }

    public String getRenderedText() {
        return renderedText;
    }

    public List<RawSpan> getRawSpans() {
        return rawSpans;
    }

    public List<MappingSlice> getSlices() {
        return slices;
    }

    /**
     * 字符偏移对应的行号与行内位置
     *
     * @param charPos 偏移
     * @param sourceSpace true 表示偏移位于源码，false 表示位于渲染文本
     */
    public LinePosition lineAndPosition(int charPos, boolean sourceSpace) {
        return sourceSpace ? sourceLines.positionOf(charPos) : renderedLines.positionOf(charPos);
    }

    /**
     * 只存在于源码中的片段（注释、块标记）
     */
    public List<RawSpan> sourceOnlySpans() {
        List<RawSpan> result = new ArrayList<>();
        for (RawSpan span : rawSpans) {
            if (span.isSourceOnly()) {
                result.add(span);
            }
        }
        return result;
    }

    /**
     * 查找与渲染位置相关的切片下标范围 [first, last)
     *
     * @param renderedPos 渲染位置
     * @param startIdx 起始搜索下标
     * @param inclusive 是否包含从该位置开始的切片
     */
    public SliceIndices findSliceIndicesOfRenderedPos(int renderedPos, int startIdx, boolean inclusive) {
        int first = -1;
        int last = startIdx;
        boolean broke = false;
        for (int idx = startIdx; idx < slices.size(); idx++) {
            TextRange rendered = slices.get(idx).getRenderedRange();
            last = idx;
            if (rendered.end() >= renderedPos) {
                if (first < 0) {
                    first = idx;
                }
                if (rendered.start() > renderedPos || (!inclusive && rendered.start() >= renderedPos)) {
                    broke = true;
                    break;
                }
            }
        }
        if (!broke) {
            last++;
        }
        if (first < 0) {
            throw new IllegalArgumentException("Rendered position " + renderedPos + " not found in " + fileName);
        }
        return new SliceIndices(first, last);
    }

    public SliceIndices findSliceIndicesOfRenderedPos(int renderedPos) {
        return findSliceIndicesOfRenderedPos(renderedPos, 0, true);
    }

    /**
     * 把渲染区间换算为源码区间
     * <p>
     * 字面量切片内部按字符精确换算；落在模板切片内部的端点扩展到整个模板切片的源码区间。
     * 零宽区间优先落在切片接缝处。
     * </p>
     */
    public TextRange renderedRangeToSourceRange(TextRange renderedRange) {
        if (slices.isEmpty()) {
            return renderedRange;
        }
        if (renderedRange.isEmpty()) {
            return renderedPointToSource(renderedRange.start());
        }

        int startIdx = -1;
        for (int i = 0; i < slices.size(); i++) {
            if (slices.get(i).getRenderedRange().contains(renderedRange.start())) {
                startIdx = i;
                break;
            }
        }
        if (startIdx < 0) {
            throw new IllegalArgumentException("Rendered range " + renderedRange + " is outside of " + fileName);
        }
        MappingSlice startSlice = slices.get(startIdx);
        int sourceStart = startSlice.getKind() == SpanKind.LITERAL
                ? startSlice.getSourceRange().start() + (renderedRange.start() - startSlice.getRenderedRange().start())
                : startSlice.getSourceRange().start();

        MappingSlice stopSlice = null;
        for (int i = startIdx; i < slices.size(); i++) {
            TextRange rendered = slices.get(i).getRenderedRange();
            if (rendered.start() < renderedRange.end() && rendered.end() >= renderedRange.end()) {
                stopSlice = slices.get(i);
                break;
            }
        }
        if (stopSlice == null) {
            throw new IllegalArgumentException("Rendered range " + renderedRange + " is outside of " + fileName);
        }
        int sourceStop = stopSlice.getKind() == SpanKind.LITERAL
                ? stopSlice.getSourceRange().end() - (stopSlice.getRenderedRange().end() - renderedRange.end())
                : stopSlice.getSourceRange().end();

        return new TextRange(Math.min(sourceStart, sourceStop), Math.max(sourceStart, sourceStop));
    }

    private TextRange renderedPointToSource(int renderedPos) {
        SliceIndices indices = findSliceIndicesOfRenderedPos(renderedPos);
        int insertionPoint = -1;
        for (int i = indices.first(); i < indices.last(); i++) {
            MappingSlice slice = slices.get(i);
            TextRange rendered = slice.getRenderedRange();
            if (rendered.isEmpty()) {
                insertionPoint = minPoint(insertionPoint, slice.getSourceRange().end());
            }
            if (rendered.start() == renderedPos) {
                insertionPoint = minPoint(insertionPoint, slice.getSourceRange().start());
            }
            if (rendered.end() == renderedPos) {
                insertionPoint = minPoint(insertionPoint, slice.getSourceRange().end());
            }
        }
        if (insertionPoint >= 0) {
            return TextRange.point(insertionPoint);
        }
        MappingSlice containing = slices.get(indices.first());
        if (containing.getKind() == SpanKind.LITERAL) {
            int offset = renderedPos - containing.getRenderedRange().start();
            return TextRange.point(containing.getSourceRange().start() + offset);
        }
        throw new IllegalArgumentException(
                "Zero-length rendered position " + renderedPos + " falls inside a templated section of " + fileName);
    }

    private static int minPoint(int current, int candidate) {
        return current < 0 ? candidate : Math.min(current, candidate);
    }

    /**
     * 源码区间是否完全由字面量构成；零宽区间视为字面量
     */
    public boolean isSourceRangeLiteral(TextRange sourceRange) {
        if (rawSpans.isEmpty() || sourceRange.isEmpty()) {
            return true;
        }
        for (RawSpan span : rawSpansSpanning(sourceRange)) {
            if (span.getKind() != SpanKind.LITERAL) {
                return false;
            }
        }
        return true;
    }

    /**
     * 覆盖给定源码区间的原始片段
     */
    public List<RawSpan> rawSpansSpanning(TextRange sourceRange) {
        if (rawSpans.isEmpty()) {
            return Collections.emptyList();
        }
        RawSpan lastSpan = rawSpans.get(rawSpans.size() - 1);
        if (sourceRange.start() >= lastSpan.getEnd()) {
            return Collections.emptyList();
        }
        int idx = 0;
        while (idx + 1 < rawSpans.size() && rawSpans.get(idx + 1).getSourceOffset() <= sourceRange.start()) {
            idx++;
        }
        int span = 1;
        while (idx + span < rawSpans.size() && rawSpans.get(idx + span).getSourceOffset() < sourceRange.end()) {
            span++;
        }
        return rawSpans.subList(idx, idx + span);
    }

    /**
     * 切片下标范围 [first, last)
     */
    public record SliceIndices(int first, int last) {
    }

    @Override
    public String toString() {
        return "TemplatedFile{" + fileName + ", slices=" + slices.size() + "}";
    }
}
