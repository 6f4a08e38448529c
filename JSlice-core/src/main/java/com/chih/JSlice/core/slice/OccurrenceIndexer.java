package com.chih.JSlice.core.slice;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 出现位置索引
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public final class OccurrenceIndexer {

    private OccurrenceIndexer() {
    }

    /**
     * 为每个子串找出它在 haystack 中的全部起始位置（允许重叠）
     *
     * @param haystack 被搜索的文本
     * @param needles 子串集合，空子串映射为空列表
     * @return 出现位置表，键顺序与 needles 的迭代顺序一致
     */
    public static OccurrenceTable index(String haystack, Collection<String> needles) {
        Map<String, List<Integer>> result = new LinkedHashMap<>();
        for (String needle : needles) {
            result.put(needle, findAll(haystack, needle));
        }
        return new OccurrenceTable(result);
    }

    static List<Integer> findAll(String haystack, String needle) {
        List<Integer> offsets = new ArrayList<>();
        if (needle.isEmpty() || haystack.isEmpty()) {
            return offsets;
        }
        int idx = haystack.indexOf(needle);
        while (idx >= 0) {
            offsets.add(idx);
            idx = haystack.indexOf(needle, idx + 1);
        }
        return offsets;
    }
}
