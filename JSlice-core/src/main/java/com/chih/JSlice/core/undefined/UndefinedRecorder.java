package com.chih.JSlice.core.undefined;

/**
 * 记录型占位值：被输出、取属性或做条件判断时把自身名称记入 {@link UndefinedSet}，输出为空串
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public class UndefinedRecorder extends Sentinel {

    private final UndefinedSet undefinedSet;

    public UndefinedRecorder(String name, UndefinedSet undefinedSet) {
        super(name);
        this.undefinedSet = undefinedSet;
    }

    @Override
    public String toText() {
        undefinedSet.record(name);
        return "";
    }

    @Override
    public Sentinel getAttribute(String attribute) {
        undefinedSet.record(name);
        return new UndefinedRecorder(name + "." + attribute, undefinedSet);
    }

    @Override
    public Sentinel call(Object... args) {
        return new UndefinedRecorder(name + "()", undefinedSet);
    }

    @Override
    public boolean asBool() {
        undefinedSet.record(name);
        return false;
    }
}
