package com.chih.JSlice.core.undefined;

/**
 * 忽略模式下的占位值：不做记录，输出由名称派生的文本（点号替换为下划线），条件判断恒为真
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public class DummyUndefined extends Sentinel {

    public DummyUndefined(String name) {
        super(name);
    }

    @Override
    public String toText() {
        return name.replace('.', '_');
    }

    @Override
    public Sentinel getAttribute(String attribute) {
        return new DummyUndefined(name + "." + attribute);
    }

    @Override
    public Sentinel call(Object... args) {
        return this;
    }

    @Override
    public boolean asBool() {
        return true;
    }
}
