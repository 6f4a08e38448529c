package com.chih.JSlice.core.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 原始片段 / 映射切片的类型
 * <p>
 * {@link #TEMPLATED} 同时充当映射切片的兜底类型：无法逐字对应的区域一律归为 TEMPLATED。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public enum SpanKind {

    LITERAL("literal"),
    TEMPLATED("templated"),
    BLOCK_START("block_start"),
    BLOCK_END("block_end"),
    ESCAPED("escaped"),
    COMMENT("comment");

    private final String label;

    SpanKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * 块标记：自身渲染输出恒为零长度
     */
    public boolean isBlock() {
        return this == BLOCK_START || this == BLOCK_END;
    }

    /**
     * 只存在于源码、不产生任何渲染输出的类型
     */
    public boolean isSourceOnly() {
        return isBlock() || this == COMMENT;
    }
}
