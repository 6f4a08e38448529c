package com.chih.JSlice.core.slice;

import com.chih.JSlice.core.domain.RawSpan;
import com.chih.JSlice.core.domain.SpanKind;
import com.chih.JSlice.core.domain.TextRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 不变量切分：以原文和渲染结果中都只出现一次的字面量为锚点，
 * 把原始片段序列切成 INVARIANT 与 COMPOUND 交替的骨架
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
final class InvariantSplitter {

    private static final Logger log = LoggerFactory.getLogger(InvariantSplitter.class);

    /**
     * 找出不变量
     * <p>
     * 候选按长度从长到短处理，与较长候选在原文、渲染结果中相对顺序不一致的候选会被剔除。
     * </p>
     */
    static Set<String> findInvariants(Collection<String> literals, OccurrenceTable rawOccurrences,
                                      OccurrenceTable renderedOccurrences) {
        Set<String> invariants = new LinkedHashSet<>();
        for (String literal : literals) {
            if (rawOccurrences.count(literal) == 1 && renderedOccurrences.count(literal) == 1) {
                invariants.add(literal);
            }
        }
        List<String> byLength = new ArrayList<>(invariants);
        byLength.sort(Comparator.comparingInt(String::length).reversed());
        for (String longer : byLength) {
            if (!invariants.contains(longer)) {
                continue;
            }
            int sourcePos = rawOccurrences.positions(longer).get(0);
            int renderedPos = renderedOccurrences.positions(longer).get(0);
            for (String other : new ArrayList<>(invariants)) {
                if (other.equals(longer)) {
                    continue;
                }
                boolean sourceAfter = sourcePos > rawOccurrences.positions(other).get(0);
                boolean renderedAfter = renderedPos > renderedOccurrences.positions(other).get(0);
                if (sourceAfter != renderedAfter) {
                    log.debug("Dropping invariant {} which is out of order relative to {}", quote(other), quote(longer));
                    invariants.remove(other);
                }
            }
        }
        return invariants;
    }

    List<IntermediateFragment> split(List<RawSpan> spans, Collection<String> literals,
                                     OccurrenceTable rawOccurrences, OccurrenceTable renderedOccurrences,
                                     int renderedLength) {
        Set<String> invariants = findInvariants(literals, rawOccurrences, renderedOccurrences);
        List<IntermediateFragment> fragments = new ArrayList<>();
        List<RawSpan> buffer = new ArrayList<>();
        int renderedIdx = 0;
        int sourceIdx = 0;

        for (RawSpan span : spans) {
            if (span.getKind() == SpanKind.LITERAL && invariants.contains(span.getText())) {
                int renderedPos = renderedOccurrences.positions(span.getText()).get(0);
                if (renderedPos >= renderedIdx) {
                    flush(fragments, buffer, sourceIdx, span.getSourceOffset(), renderedIdx, renderedPos);
                    fragments.add(IntermediateFragment.invariant(span, renderedPos));
                    renderedIdx = renderedPos + span.getText().length();
                    sourceIdx = span.getEnd();
                    continue;
                }
                // 与前一个锚点在渲染结果中重叠，降级为普通片段
                log.debug("Demoting invariant {} at rendered offset {} behind cursor {}",
                        quote(span.getText()), renderedPos, renderedIdx);
            }
            buffer.add(span);
        }
        int sourceEnd = spans.isEmpty() ? 0 : spans.get(spans.size() - 1).getEnd();
        flush(fragments, buffer, sourceIdx, sourceEnd, renderedIdx, renderedLength);
        return fragments;
    }

    private static void flush(List<IntermediateFragment> fragments, List<RawSpan> buffer,
                              int sourceStart, int sourceEnd, int renderedStart, int renderedEnd) {
        if (!buffer.isEmpty()) {
            fragments.add(IntermediateFragment.compound(new TextRange(sourceStart, sourceEnd),
                    new TextRange(renderedStart, renderedEnd), buffer));
            buffer.clear();
        } else if (renderedEnd > renderedStart) {
            fragments.add(IntermediateFragment.gap(sourceStart, new TextRange(renderedStart, renderedEnd)));
        }
    }

    private static String quote(String text) {
        return "'" + text.replace("\n", "\\n") + "'";
    }
}
