package com.chih.JSlice.core.slice;

import com.chih.JSlice.core.domain.MappingSlice;
import com.chih.JSlice.core.domain.RawSpan;
import com.chih.JSlice.core.domain.SpanKind;
import com.chih.JSlice.core.domain.TextRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 复合片段解析
 * <p>
 * 对每个片段依次尝试：零宽映射、单片段直接映射、首尾修剪、以局部唯一字面量为锚点切分递归，
 * 最后退化为逐对合并。每一步产出的切片在源码与渲染两条轴上都保持连续。
 * </p>
 *
 * <h3>递归终止</h3>
 * <p>
 * 以锚点切分时，锚点前后的子片段都严格少于当前片段的原始片段数；
 * 逐对合并不再递归，因此整个过程必然终止。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
final class CompoundResolver {

    private static final Logger log = LoggerFactory.getLogger(CompoundResolver.class);

    private final BoundaryTrimmer trimmer = new BoundaryTrimmer();

    List<MappingSlice> resolve(List<IntermediateFragment> fragments, OccurrenceTable rawOccurrences,
                               OccurrenceTable renderedOccurrences, String rendered) {
        List<MappingSlice> out = new ArrayList<>();
        for (IntermediateFragment fragment : fragments) {
            resolveFragment(fragment, rawOccurrences, renderedOccurrences, rendered, out);
        }
        return out;
    }

    void resolveFragment(IntermediateFragment fragment, OccurrenceTable rawOccurrences,
                         OccurrenceTable renderedOccurrences, String rendered, List<MappingSlice> out) {
        if (fragment.spans().isEmpty()) {
            emitUnattributed(fragment, out);
            return;
        }
        if (fragment.renderedRange().isEmpty()) {
            out.addAll(fragment.pointSlices());
            return;
        }
        if (fragment.spans().size() == 1) {
            emitSingle(fragment, rendered, out);
            return;
        }

        BoundaryTrimmer.TrimResult trimmed = trimmer.trim(fragment, rendered);
        out.addAll(trimmed.head());
        IntermediateFragment middle = trimmed.middle();
        if (middle.spans().isEmpty()) {
            emitUnattributed(middle, out);
        } else if (middle.renderedRange().isEmpty()) {
            out.addAll(middle.pointSlices());
        } else if (middle.spans().size() == 1) {
            emitSingle(middle, rendered, out);
        } else {
            splitOnUniques(middle, rawOccurrences, renderedOccurrences, rendered, out);
        }
        out.addAll(trimmed.tail());
    }

    /**
     * 以两侧都只出现一次的字面量为锚点切分
     */
    private void splitOnUniques(IntermediateFragment fragment, OccurrenceTable rawOccurrences,
                                OccurrenceTable renderedOccurrences, String rendered, List<MappingSlice> out) {
        OccurrenceTable rawLocal = rawOccurrences.within(fragment.sourceRange());
        OccurrenceTable renderedLocal = renderedOccurrences.within(fragment.renderedRange());
        List<String> uniques = new ArrayList<>();
        for (String text : rawLocal.texts()) {
            if (rawLocal.count(text) == 1 && renderedLocal.count(text) == 1) {
                uniques.add(text);
            }
        }
        if (uniques.isEmpty()) {
            log.debug("No locally unique literal in {}, coalescing pairwise", fragment);
            out.addAll(pairwiseCoalesce(fragment, rendered));
            return;
        }

        List<RawSpan> spans = fragment.spans();
        List<MappingSlice> local = new ArrayList<>();
        int bookmark = 0;
        int sourceCursor = fragment.sourceRange().start();
        int renderedCursor = fragment.renderedRange().start();
        int renderedEnd = fragment.renderedRange().end();

        for (int idx = 0; idx < spans.size(); idx++) {
            RawSpan span = spans.get(idx);
            if (span.getKind() != SpanKind.LITERAL) {
                continue;
            }
            Anchor anchor = findAnchor(span, uniques, rawLocal, renderedLocal, rendered, renderedCursor,
                    renderedEnd, idx == bookmark, idx == spans.size() - 1);
            if (anchor == null) {
                continue;
            }
            if (idx > bookmark) {
                IntermediateFragment before = IntermediateFragment.compound(
                        new TextRange(sourceCursor, span.getSourceOffset()),
                        new TextRange(renderedCursor, anchor.spanRenderedStart()),
                        spans.subList(bookmark, idx));
                resolveFragment(before, rawOccurrences, renderedOccurrences, rendered, local);
            }
            emitAnchoredLiteral(span, anchor, local);
            sourceCursor = span.getEnd();
            renderedCursor = anchor.spanRenderedStart() + span.getText().length();
            bookmark = idx + 1;
        }

        if (bookmark == 0) {
            log.debug("Unique literals {} could not anchor {}, coalescing pairwise", uniques, fragment);
            out.addAll(pairwiseCoalesce(fragment, rendered));
            return;
        }
        if (bookmark < spans.size()) {
            IntermediateFragment rest = IntermediateFragment.compound(
                    new TextRange(sourceCursor, fragment.sourceRange().end()),
                    new TextRange(renderedCursor, renderedEnd),
                    spans.subList(bookmark, spans.size()));
            resolveFragment(rest, rawOccurrences, renderedOccurrences, rendered, local);
        }
        out.addAll(local);
    }

    /**
     * 在字面量片段中寻找可用的锚点，要求整个片段文本在渲染结果中原样出现且位置不回退
     */
    private static Anchor findAnchor(RawSpan span, List<String> uniques, OccurrenceTable rawLocal,
                                     OccurrenceTable renderedLocal, String rendered, int renderedCursor,
                                     int renderedEnd, boolean mustStartAtCursor, boolean mustReachEnd) {
        Anchor best = null;
        for (String unique : uniques) {
            int rawPos = rawLocal.positions(unique).get(0);
            if (rawPos < span.getSourceOffset() || rawPos + unique.length() > span.getEnd()) {
                continue;
            }
            int posInSpan = rawPos - span.getSourceOffset();
            int spanRenderedStart = renderedLocal.positions(unique).get(0) - posInSpan;
            int spanRenderedEnd = spanRenderedStart + span.getText().length();
            if (spanRenderedStart < renderedCursor || spanRenderedEnd > renderedEnd) {
                continue;
            }
            if (mustStartAtCursor && spanRenderedStart != renderedCursor) {
                continue;
            }
            if (mustReachEnd && spanRenderedEnd != renderedEnd) {
                continue;
            }
            if (!rendered.startsWith(span.getText(), spanRenderedStart)) {
                continue;
            }
            if (best == null || posInSpan < best.posInSpan()
                    || (posInSpan == best.posInSpan() && unique.length() > best.length())) {
                best = new Anchor(posInSpan, unique.length(), spanRenderedStart);
            }
        }
        return best;
    }

    private static void emitAnchoredLiteral(RawSpan span, Anchor anchor, List<MappingSlice> out) {
        int source = span.getSourceOffset();
        int rendered = anchor.spanRenderedStart();
        int uniqueStart = anchor.posInSpan();
        int uniqueEnd = uniqueStart + anchor.length();
        int length = span.getText().length();
        if (uniqueStart > 0) {
            out.add(MappingSlice.of(SpanKind.LITERAL, source, source + uniqueStart, rendered, rendered + uniqueStart));
        }
        out.add(MappingSlice.of(SpanKind.LITERAL, source + uniqueStart, source + uniqueEnd,
                rendered + uniqueStart, rendered + uniqueEnd));
        if (uniqueEnd < length) {
            out.add(MappingSlice.of(SpanKind.LITERAL, source + uniqueEnd, source + length,
                    rendered + uniqueEnd, rendered + length));
        }
    }

    /**
     * 逐对合并：从左到右把字面量片段对齐到渲染文本中最早可行的位置，
     * 夹在两个锚定字面量之间的其余片段合并为一条切片
     * <p>
     * 最后一个片段若为字面量，必须恰好对齐到片段末尾，否则并入待合并部分。
     * </p>
     */
    List<MappingSlice> pairwiseCoalesce(IntermediateFragment fragment, String rendered) {
        List<MappingSlice> out = new ArrayList<>();
        List<RawSpan> pending = new ArrayList<>();
        List<RawSpan> spans = fragment.spans();
        int cursor = fragment.renderedRange().start();
        int renderedEnd = fragment.renderedRange().end();

        for (int i = 0; i < spans.size(); i++) {
            RawSpan span = spans.get(i);
            if (span.getKind() == SpanKind.LITERAL) {
                int occurrence = locate(span.getText(), rendered, cursor, renderedEnd,
                        pending.isEmpty(), i == spans.size() - 1);
                if (occurrence >= 0) {
                    flushPending(pending, span.getSourceOffset(), cursor, occurrence, rendered, out);
                    int end = occurrence + span.getText().length();
                    out.add(new MappingSlice(SpanKind.LITERAL, span.sourceRange(), new TextRange(occurrence, end)));
                    cursor = end;
                    continue;
                }
            }
            pending.add(span);
        }
        flushPending(pending, fragment.sourceRange().end(), cursor, renderedEnd, rendered, out);
        return out;
    }

    private static int locate(String text, String rendered, int cursor, int renderedEnd,
                              boolean atCursor, boolean atEnd) {
        int length = text.length();
        if (atEnd) {
            int candidate = renderedEnd - length;
            if (candidate < cursor || (atCursor && candidate != cursor) || !rendered.startsWith(text, candidate)) {
                return -1;
            }
            return candidate;
        }
        if (atCursor) {
            return cursor + length <= renderedEnd && rendered.startsWith(text, cursor) ? cursor : -1;
        }
        int candidate = rendered.indexOf(text, cursor);
        return candidate >= 0 && candidate + length <= renderedEnd ? candidate : -1;
    }

    /**
     * 把待合并片段映射到 [renderedStart, renderedEnd)
     */
    private static void flushPending(List<RawSpan> pending, int sourcePos, int renderedStart, int renderedEnd,
                                     String rendered, List<MappingSlice> out) {
        if (pending.isEmpty()) {
            if (renderedEnd > renderedStart) {
                out.add(new MappingSlice(SpanKind.TEMPLATED, TextRange.point(sourcePos),
                        new TextRange(renderedStart, renderedEnd)));
            }
            return;
        }
        if (renderedStart == renderedEnd) {
            for (RawSpan span : pending) {
                out.add(new MappingSlice(IntermediateFragment.pointKind(span), span.sourceRange(),
                        TextRange.point(renderedStart)));
            }
            pending.clear();
            return;
        }

        coalesceAroundMarkers(pending, new TextRange(renderedStart, renderedEnd), rendered, out);
        pending.clear();
    }

    /**
     * 单片段映射；块标记或注释对应到非空渲染文本时，标记本身仍为零宽
     */
    private static void emitSingle(IntermediateFragment fragment, String rendered, List<MappingSlice> out) {
        if (fragment.spans().get(0).isSourceOnly() && !fragment.renderedRange().isEmpty()) {
            coalesceAroundMarkers(fragment.spans(), fragment.renderedRange(), rendered, out);
        } else {
            out.add(fragment.simpleSlice(rendered));
        }
    }

    /**
     * 把一组片段整体映射到 renderedRange
     * <p>
     * 块标记与注释各自映射为零宽切片，标记之间的每组片段合并为一条切片，
     * 渲染区间按各组源码长度的比例切分。全部是标记时，渲染文本挂在最后一个标记之后。
     * </p>
     */
    static void coalesceAroundMarkers(List<RawSpan> spans, TextRange renderedRange, String rendered,
                                      List<MappingSlice> out) {
        long groupedLength = 0;
        for (RawSpan span : spans) {
            if (!span.isSourceOnly()) {
                groupedLength += span.getText().length();
            }
        }
        int cursor = renderedRange.start();
        if (groupedLength == 0) {
            for (RawSpan span : spans) {
                out.add(new MappingSlice(span.getKind(), span.sourceRange(), TextRange.point(cursor)));
            }
            if (!renderedRange.isEmpty()) {
                out.add(new MappingSlice(SpanKind.TEMPLATED,
                        TextRange.point(spans.get(spans.size() - 1).getEnd()), renderedRange));
            }
            return;
        }

        long consumed = 0;
        List<RawSpan> group = new ArrayList<>();
        for (int i = 0; i <= spans.size(); i++) {
            RawSpan span = i < spans.size() ? spans.get(i) : null;
            if (span != null && !span.isSourceOnly()) {
                group.add(span);
                continue;
            }
            if (!group.isEmpty()) {
                for (RawSpan member : group) {
                    consumed += member.getText().length();
                }
                int end = renderedRange.start() + (int) (renderedRange.length() * consumed / groupedLength);
                emitGroup(group, new TextRange(cursor, end), rendered, out);
                cursor = end;
                group.clear();
            }
            if (span != null) {
                out.add(new MappingSlice(span.getKind(), span.sourceRange(), TextRange.point(cursor)));
            }
        }
    }

    private static void emitGroup(List<RawSpan> group, TextRange renderedRange, String rendered,
                                  List<MappingSlice> out) {
        if (renderedRange.isEmpty()) {
            for (RawSpan span : group) {
                out.add(new MappingSlice(IntermediateFragment.pointKind(span), span.sourceRange(), renderedRange));
            }
            return;
        }
        out.add(new MappingSlice(IntermediateFragment.coalescedKind(group, renderedRange.slice(rendered)),
                new TextRange(group.get(0).getSourceOffset(), group.get(group.size() - 1).getEnd()),
                renderedRange));
    }

    private void emitUnattributed(IntermediateFragment fragment, List<MappingSlice> out) {
        if (!fragment.renderedRange().isEmpty() || !fragment.sourceRange().isEmpty()) {
            out.add(new MappingSlice(SpanKind.TEMPLATED, fragment.sourceRange(), fragment.renderedRange()));
        }
    }

    private record Anchor(int posInSpan, int length, int spanRenderedStart) {
    }
}
