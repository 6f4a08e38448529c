package com.chih.JSlice.core.slice;

import com.chih.JSlice.core.domain.MappingSlice;
import com.chih.JSlice.core.domain.RawSpan;
import com.chih.JSlice.core.domain.SpanKind;
import com.chih.JSlice.core.domain.TemplatedFile;
import com.chih.JSlice.core.domain.TextRange;
import com.chih.JSlice.core.spi.RenderFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 模板切片对齐引擎入口
 * <p>
 * 由（原始文本、词法片段、渲染回调）重建原始文本与渲染文本之间的位置映射：
 * <ol>
 *   <li>调用一次渲染回调得到渲染文本</li>
 *   <li>分别为原文与渲染文本建立字面量出现位置表</li>
 *   <li>以不变量切出骨架，再逐个解析复合片段</li>
 *   <li>渲染结果被额外包裹时，剥离包裹文本后重新对齐（最多两轮）</li>
 * </ol>
 * 对合法输入永不抛出异常，歧义区域只会降低映射精度。
 * 实例无可变状态，可在多个线程间共享。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public class TemplateSlicer {

    private static final Logger log = LoggerFactory.getLogger(TemplateSlicer.class);

    private static final int MAX_PASSES = 2;

    private final boolean unwrapWrappedQueries;
    private final InvariantSplitter splitter = new InvariantSplitter();
    private final CompoundResolver resolver = new CompoundResolver();

    public TemplateSlicer() {
        this(true);
    }

    public TemplateSlicer(boolean unwrapWrappedQueries) {
        this.unwrapWrappedQueries = unwrapWrappedQueries;
    }

    /**
     * 渲染并对齐
     *
     * @throws com.chih.JSlice.core.exception.TemplateRenderException 渲染回调失败时原样抛出
     */
    public SliceAlignment slice(String rawText, List<RawSpan> rawSpans, RenderFunction render) {
        String rendered = render.render(rawText);
        return align(rawText, rawSpans, rendered);
    }

    /**
     * 对已有的渲染文本进行对齐
     */
    public SliceAlignment align(String rawText, List<RawSpan> rawSpans, String renderedText) {
        Set<String> literals = new LinkedHashSet<>();
        for (RawSpan span : rawSpans) {
            if (span.getKind() == SpanKind.LITERAL) {
                literals.add(span.getText());
            }
        }
        OccurrenceTable rawOccurrences = OccurrenceIndexer.index(rawText, literals);

        String target = renderedText;
        List<MappingSlice> slices = alignOnce(rawSpans, literals, rawOccurrences, target);
        for (int pass = 1; pass < MAX_PASSES && unwrapWrappedQueries; pass++) {
            TextRange attributed = attributedRange(slices, rawText.length(), target.length());
            if (attributed.start() == 0 && attributed.end() == target.length()) {
                break;
            }
            log.debug("Rendered output is wrapped, trimming to {} of {} characters", attributed, target.length());
            target = attributed.slice(target);
            slices = alignOnce(rawSpans, literals, rawOccurrences, target);
        }

        if (!isContiguous(slices, rawSpans, rawText.length(), target.length())) {
            log.warn("Alignment produced a non-contiguous mapping, falling back to a coarse mapping");
            slices = fallback(rawSpans, rawText.length(), target);
        }
        if (log.isDebugEnabled()) {
            for (MappingSlice slice : slices) {
                log.debug("  {}", slice);
            }
        }
        return new SliceAlignment(target, slices, rawSpans);
    }

    private List<MappingSlice> alignOnce(List<RawSpan> rawSpans, Set<String> literals,
                                         OccurrenceTable rawOccurrences, String rendered) {
        OccurrenceTable renderedOccurrences = OccurrenceIndexer.index(rendered, literals);
        List<IntermediateFragment> fragments =
                splitter.split(rawSpans, literals, rawOccurrences, renderedOccurrences, rendered.length());
        return resolver.resolve(fragments, rawOccurrences, renderedOccurrences, rendered);
    }

    /**
     * 去掉首尾没有源码对应的包裹文本后剩余的渲染区间
     */
    static TextRange attributedRange(List<MappingSlice> slices, int sourceLength, int renderedLength) {
        int start = 0;
        int end = renderedLength;
        if (!slices.isEmpty()) {
            MappingSlice first = slices.get(0);
            if (isWrapper(first) && first.getSourceRange().start() == 0) {
                start = first.getRenderedRange().end();
            }
            MappingSlice last = slices.get(slices.size() - 1);
            if (slices.size() > 1 && isWrapper(last) && last.getSourceRange().end() == sourceLength) {
                end = last.getRenderedRange().start();
            }
        }
        return new TextRange(start, Math.max(start, end));
    }

    private static boolean isWrapper(MappingSlice slice) {
        return slice.getKind() == SpanKind.TEMPLATED
                && slice.getSourceRange().isEmpty()
                && !slice.getRenderedRange().isEmpty();
    }

    /**
     * 两条轴上连续且完整覆盖，并且每个块标记都有独立的零宽切片
     */
    static boolean isContiguous(List<MappingSlice> slices, List<RawSpan> rawSpans,
                                int sourceLength, int renderedLength) {
        int source = 0;
        int rendered = 0;
        for (MappingSlice slice : slices) {
            if (slice.getSourceRange().start() != source || slice.getRenderedRange().start() != rendered) {
                return false;
            }
            if (slice.getKind().isBlock() && !slice.getRenderedRange().isEmpty()) {
                return false;
            }
            source = slice.getSourceRange().end();
            rendered = slice.getRenderedRange().end();
        }
        return source == sourceLength && rendered == renderedLength
                && TemplatedFile.firstUnmappedBlock(rawSpans, slices) == null;
    }

    /**
     * 整个文件合并映射，块标记与注释仍各自保留零宽切片
     */
    private static List<MappingSlice> fallback(List<RawSpan> rawSpans, int sourceLength, String rendered) {
        if (sourceLength == 0 && rendered.isEmpty()) {
            return List.of();
        }
        if (rawSpans.isEmpty()) {
            return List.of(MappingSlice.of(SpanKind.TEMPLATED, 0, sourceLength, 0, rendered.length()));
        }
        List<MappingSlice> out = new ArrayList<>();
        CompoundResolver.coalesceAroundMarkers(rawSpans, new TextRange(0, rendered.length()), rendered, out);
        return out;
    }
}
