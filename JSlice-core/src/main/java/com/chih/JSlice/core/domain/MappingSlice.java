package com.chih.JSlice.core.domain;

import java.util.Objects;

/**
 * 源码区间与渲染区间之间的一条映射
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public final class MappingSlice {

    private final SpanKind kind;
    private final TextRange sourceRange;
    private final TextRange renderedRange;

    public MappingSlice(SpanKind kind, TextRange sourceRange, TextRange renderedRange) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.sourceRange = Objects.requireNonNull(sourceRange, "sourceRange");
        this.renderedRange = Objects.requireNonNull(renderedRange, "renderedRange");
    }

    public static MappingSlice of(SpanKind kind, int sourceStart, int sourceEnd, int renderedStart, int renderedEnd) {
        return new MappingSlice(kind, new TextRange(sourceStart, sourceEnd), new TextRange(renderedStart, renderedEnd));
    }

    public SpanKind getKind() {
        return kind;
    }

    public TextRange getSourceRange() {
        return sourceRange;
    }

    public TextRange getRenderedRange() {
        return renderedRange;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MappingSlice that)) {
            return false;
        }
        return kind == that.kind && sourceRange.equals(that.sourceRange) && renderedRange.equals(that.renderedRange);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, sourceRange, renderedRange);
    }

    @Override
    public String toString() {
        return kind.label() + " source" + sourceRange + " -> rendered" + renderedRange;
    }
}
