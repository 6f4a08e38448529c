package com.chih.JSlice.core.slice;

import com.chih.JSlice.core.domain.MappingSlice;
import com.chih.JSlice.core.domain.RawSpan;
import com.chih.JSlice.core.domain.SpanKind;
import com.chih.JSlice.core.domain.TextRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 首尾修剪：把片段两端能逐字匹配的字面量剥离出来
 * <p>
 * 注释与块标记按零宽切片剥离；一端剥离了块标记后，该端立即停止，
 * 块标记之后的内容留给中段继续解析。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
final class BoundaryTrimmer {

    record TrimResult(List<MappingSlice> head, IntermediateFragment middle, List<MappingSlice> tail) {
    }

    TrimResult trim(IntermediateFragment fragment, String rendered) {
        List<RawSpan> spans = new ArrayList<>(fragment.spans());
        int sourceStart = fragment.sourceRange().start();
        int sourceEnd = fragment.sourceRange().end();
        int renderedStart = fragment.renderedRange().start();
        int renderedEnd = fragment.renderedRange().end();

        List<MappingSlice> head = new ArrayList<>();
        while (!spans.isEmpty()) {
            RawSpan first = spans.get(0);
            if (first.isSourceOnly()) {
                head.add(new MappingSlice(first.getKind(), first.sourceRange(), TextRange.point(renderedStart)));
                spans.remove(0);
                sourceStart = first.getEnd();
                if (first.getKind().isBlock()) {
                    break;
                }
                continue;
            }
            if (first.getKind() != SpanKind.LITERAL) {
                break;
            }
            int common = commonPrefix(first.getText(), rendered, renderedStart, renderedEnd);
            if (common == 0) {
                break;
            }
            int splitAt = first.getSourceOffset() + common;
            head.add(MappingSlice.of(SpanKind.LITERAL, first.getSourceOffset(), splitAt,
                    renderedStart, renderedStart + common));
            renderedStart += common;
            sourceStart = splitAt;
            spans.remove(0);
            if (common < first.getText().length()) {
                spans.add(0, new RawSpan(first.getText().substring(common), SpanKind.LITERAL, splitAt));
                break;
            }
        }

        List<MappingSlice> tail = new ArrayList<>();
        while (!spans.isEmpty()) {
            RawSpan last = spans.get(spans.size() - 1);
            if (last.isSourceOnly()) {
                tail.add(new MappingSlice(last.getKind(), last.sourceRange(), TextRange.point(renderedEnd)));
                spans.remove(spans.size() - 1);
                sourceEnd = last.getSourceOffset();
                if (last.getKind().isBlock()) {
                    break;
                }
                continue;
            }
            if (last.getKind() != SpanKind.LITERAL) {
                break;
            }
            int common = commonSuffix(last.getText(), rendered, renderedStart, renderedEnd);
            if (common == 0) {
                break;
            }
            int splitAt = last.getEnd() - common;
            tail.add(MappingSlice.of(SpanKind.LITERAL, splitAt, last.getEnd(), renderedEnd - common, renderedEnd));
            renderedEnd -= common;
            sourceEnd = splitAt;
            spans.remove(spans.size() - 1);
            if (common < last.getText().length()) {
                spans.add(new RawSpan(last.getText().substring(0, last.getText().length() - common),
                        SpanKind.LITERAL, last.getSourceOffset()));
                break;
            }
        }
        Collections.reverse(tail);

        IntermediateFragment middle = IntermediateFragment.compound(
                new TextRange(sourceStart, sourceEnd), new TextRange(renderedStart, renderedEnd), spans);
        return new TrimResult(head, middle, tail);
    }

    static int commonPrefix(String text, String rendered, int from, int to) {
        int max = Math.min(text.length(), to - from);
        int i = 0;
        while (i < max && text.charAt(i) == rendered.charAt(from + i)) {
            i++;
        }
        return i;
    }

    static int commonSuffix(String text, String rendered, int from, int to) {
        int max = Math.min(text.length(), to - from);
        int i = 0;
        while (i < max && text.charAt(text.length() - 1 - i) == rendered.charAt(to - 1 - i)) {
            i++;
        }
        return i;
    }
}
