package com.chih.JSlice.core.undefined;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 未定义变量追踪
 * <p>
 * 在渲染前为模板引用到、但上下文中不存在的名称放入占位值。
 * 调用方持有 {@link UndefinedSet}，显式地把它与上下文一起交给渲染步骤。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public final class UndefinedTracker {

    private final boolean ignoreTemplating;
    private final UndefinedSet undefinedSet;

    public UndefinedTracker(boolean ignoreTemplating, UndefinedSet undefinedSet) {
        this.ignoreTemplating = ignoreTemplating;
        this.undefinedSet = Objects.requireNonNull(undefinedSet, "undefinedSet");
    }

    public Sentinel sentinelFor(String name) {
        return ignoreTemplating ? new DummyUndefined(name) : new UndefinedRecorder(name, undefinedSet);
    }

    /**
     * @param context 原始上下文，不会被修改
     * @param referencedNames 模板引用到的根名称
     * @return 补齐占位值后的上下文副本
     */
    public Map<String, Object> install(Map<String, Object> context, Collection<String> referencedNames) {
        Map<String, Object> live = new LinkedHashMap<>(context);
        for (String name : referencedNames) {
            if (!live.containsKey(name)) {
                live.put(name, sentinelFor(name));
            }
        }
        return live;
    }

    public UndefinedSet undefinedSet() {
        return undefinedSet;
    }

    public boolean isIgnoreTemplating() {
        return ignoreTemplating;
    }
}
