package com.chih.JSlice.core.slice;

import com.chih.JSlice.core.domain.TextRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 字面量文本 -> 升序出现位置
 * <p>
 * 构建后只读。没有出现过的文本返回空列表。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public final class OccurrenceTable {

    private static final OccurrenceTable EMPTY = new OccurrenceTable(Collections.emptyMap());

    private static final Comparator<Occurrence> BY_OFFSET_THEN_TEXT =
            Comparator.comparingInt(Occurrence::offset).thenComparing(Occurrence::text);

    private final Map<String, List<Integer>> positions;

    OccurrenceTable(Map<String, List<Integer>> positions) {
        Map<String, List<Integer>> copy = new LinkedHashMap<>();
        positions.forEach((text, offsets) -> copy.put(text, List.copyOf(offsets)));
        this.positions = Collections.unmodifiableMap(copy);
    }

    public static OccurrenceTable empty() {
        return EMPTY;
    }

    public List<Integer> positions(String text) {
        return positions.getOrDefault(text, Collections.emptyList());
    }

    public int count(String text) {
        return positions(text).size();
    }

    public Set<String> texts() {
        return positions.keySet();
    }

    /**
     * 没有任何出现位置
     */
    public boolean isEmpty() {
        return positions.values().stream().allMatch(List::isEmpty);
    }

    /**
     * 只保留落在区间内的出现位置，丢弃过滤后为空的条目
     */
    public OccurrenceTable within(TextRange range) {
        Map<String, List<Integer>> filtered = new LinkedHashMap<>();
        positions.forEach((text, offsets) -> {
            List<Integer> kept = new ArrayList<>();
            for (int offset : offsets) {
                if (range.contains(offset)) {
                    kept.add(offset);
                }
            }
            if (!kept.isEmpty()) {
                filtered.put(text, kept);
            }
        });
        return new OccurrenceTable(filtered);
    }

    /**
     * 全部 (文本, 位置) 二元组，按位置、再按文本排序
     */
    public List<Occurrence> sortedOccurrences() {
        List<Occurrence> result = new ArrayList<>();
        positions.forEach((text, offsets) -> offsets.forEach(offset -> result.add(new Occurrence(text, offset))));
        result.sort(BY_OFFSET_THEN_TEXT);
        return result;
    }

    public Map<String, List<Integer>> asMap() {
        return positions;
    }

    public record Occurrence(String text, int offset) {
    }

    @Override
    public String toString() {
        return positions.toString();
    }
}
