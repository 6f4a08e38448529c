package com.chih.JSlice.core.undefined;

import java.util.AbstractMap;
import java.util.Collections;
import java.util.Set;

/**
 * 未定义变量的占位值
 * <p>
 * 渲染时代替上下文中缺失的名称，使渲染得以继续。
 * 继承 {@link AbstractMap} 是为了让按 Map 查找属性的模板引擎（如 Mustache 的点号语法）
 * 自然地走到 {@link #getAttribute(String)}：任何键都视为存在。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public abstract class Sentinel extends AbstractMap<String, Object> {

    protected final String name;

    protected Sentinel(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * 输出到渲染结果中的文本
     */
    public abstract String toText();

    /**
     * 属性访问，返回派生名称 {@code name.attribute} 的占位值
     */
    public abstract Sentinel getAttribute(String attribute);

    /**
     * 作为函数调用
     */
    public abstract Sentinel call(Object... args);

    /**
     * 在条件 / 区块中的真假值
     */
    public abstract boolean asBool();

    @Override
    public Set<Entry<String, Object>> entrySet() {
        return Collections.emptySet();
    }

    @Override
    public boolean containsKey(Object key) {
        return key != null;
    }

    @Override
    public Object get(Object key) {
        return key == null ? null : getAttribute(String.valueOf(key));
    }

    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ")";
    }
}
