package com.chih.JSlice.core.domain;

import java.util.Objects;

/**
 * 原始模板文本中的一个词法片段
 * <p>
 * 按顺序拼接所有片段的 text 可精确还原原始文本，且第 i+1 个片段的 sourceOffset
 * 等于第 i 个片段的 sourceOffset + text 长度。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public final class RawSpan {

    private final String text;
    private final SpanKind kind;
    private final int sourceOffset;

    public RawSpan(String text, SpanKind kind, int sourceOffset) {
        this.text = Objects.requireNonNull(text, "text");
        this.kind = Objects.requireNonNull(kind, "kind");
        if (sourceOffset < 0) {
            throw new IllegalArgumentException("Negative source offset: " + sourceOffset);
        }
        this.sourceOffset = sourceOffset;
    }

    public String getText() {
        return text;
    }

    public SpanKind getKind() {
        return kind;
    }

    public int getSourceOffset() {
        return sourceOffset;
    }

    public int getEnd() {
        return sourceOffset + text.length();
    }

    public TextRange sourceRange() {
        return new TextRange(sourceOffset, getEnd());
    }

    public boolean isSourceOnly() {
        return kind.isSourceOnly();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RawSpan that)) {
            return false;
        }
        return sourceOffset == that.sourceOffset && kind == that.kind && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, kind, sourceOffset);
    }

    @Override
    public String toString() {
        return "RawSpan{" + kind.label() + " '" + text + "' @" + sourceOffset + "}";
    }
}
