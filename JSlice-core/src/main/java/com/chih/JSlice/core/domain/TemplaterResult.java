package com.chih.JSlice.core.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 一次模板处理的完整产出
 *
 * @param templatedFile 渲染文本与映射切片
 * @param undefinedNames 渲染期间访问过但上下文中不存在的名称（按首次访问顺序）
 * @param violations 未定义名称对应的源码位置
 * @author lizhiyuan
 * @since 2026/10/15
 */
public record TemplaterResult(TemplatedFile templatedFile,
                              Set<String> undefinedNames,
                              List<TemplaterViolation> violations) {

    public TemplaterResult {
        undefinedNames = Collections.unmodifiableSet(new LinkedHashSet<>(undefinedNames));
        violations = List.copyOf(violations);
    }

    public String renderedText() {
        return templatedFile.getRenderedText();
    }

    public List<MappingSlice> slices() {
        return templatedFile.getSlices();
    }
}
