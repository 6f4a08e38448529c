package com.chih.JSlice.core.undefined;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 渲染期间访问过的未定义名称
 * <p>
 * 每个名称只记录一次，保留首次访问的顺序。
 * 实例归属于单次渲染，不可在并发渲染之间共享（非线程安全）。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public final class UndefinedSet {

    private final Set<String> names = new LinkedHashSet<>();

    /**
     * @return 名称是首次记录时返回 true
     */
    public boolean record(String name) {
        return names.add(name);
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    public int size() {
        return names.size();
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
