package com.chih.JSlice.core.domain;

import com.chih.JSlice.core.exception.SliceConsistencyException;
import com.chih.JSlice.core.support.TemplatedFileJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TemplatedFile 位置换算测试")
class TemplatedFileTest {

    private static final String SOURCE = "01234\n6789{{foo}}fo\nbarss";
    private static final String RENDERED = "01234\n6789x\nfo\nbarss";

    private TemplatedFile file;

    @BeforeEach
    void setUp() {
        file = new TemplatedFile(SOURCE, "test.sql", RENDERED,
                List.of(new RawSpan("01234\n6789", SpanKind.LITERAL, 0),
                        new RawSpan("{{foo}}", SpanKind.TEMPLATED, 10),
                        new RawSpan("fo\nbarss", SpanKind.LITERAL, 17)),
                List.of(MappingSlice.of(SpanKind.LITERAL, 0, 10, 0, 10),
                        MappingSlice.of(SpanKind.TEMPLATED, 10, 17, 10, 12),
                        MappingSlice.of(SpanKind.LITERAL, 17, 25, 12, 20)));
    }

    @Test
    @DisplayName("源码偏移换算为行号与行内位置")
    void testLineAndPosition() {
        assertThat(file.lineAndPosition(0, true)).isEqualTo(new LinePosition(1, 1));
        assertThat(file.lineAndPosition(20, true)).isEqualTo(new LinePosition(3, 1));
        assertThat(file.lineAndPosition(24, true)).isEqualTo(new LinePosition(3, 5));
        // 渲染文本中多了一个换行
        assertThat(file.lineAndPosition(12, false)).isEqualTo(new LinePosition(3, 1));
    }

    @Test
    @DisplayName("查找渲染位置对应的切片下标")
    void testFindSliceIndices() {
        assertThat(file.findSliceIndicesOfRenderedPos(12)).isEqualTo(new TemplatedFile.SliceIndices(1, 3));
        assertThat(file.findSliceIndicesOfRenderedPos(20)).isEqualTo(new TemplatedFile.SliceIndices(2, 3));
        assertThat(file.findSliceIndicesOfRenderedPos(12, 0, false)).isEqualTo(new TemplatedFile.SliceIndices(1, 2));
    }

    @Test
    @DisplayName("渲染区间换算为源码区间")
    void testRenderedRangeToSourceRange() {
        // 字面量内部逐字符换算
        assertThat(file.renderedRangeToSourceRange(new TextRange(0, 3))).isEqualTo(new TextRange(0, 3));
        // 起点落在模板切片中，扩展到整个模板表达式
        assertThat(file.renderedRangeToSourceRange(new TextRange(11, 14))).isEqualTo(new TextRange(10, 19));
        // 零宽区间落在接缝处
        assertThat(file.renderedRangeToSourceRange(TextRange.point(12))).isEqualTo(TextRange.point(17));
    }

    @Test
    @DisplayName("模板切片内部的零宽位置无法换算")
    void testPointInsideTemplatedSlice() {
        TemplatedFile wide = new TemplatedFile("{{x}}", null, "abc",
                List.of(new RawSpan("{{x}}", SpanKind.TEMPLATED, 0)),
                List.of(MappingSlice.of(SpanKind.TEMPLATED, 0, 5, 0, 3)));

        assertThatThrownBy(() -> wide.renderedRangeToSourceRange(TextRange.point(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("<string>");
    }

    @Test
    @DisplayName("源码区间是否为纯字面量")
    void testIsSourceRangeLiteral() {
        assertThat(file.isSourceRangeLiteral(new TextRange(0, 5))).isTrue();
        assertThat(file.isSourceRangeLiteral(new TextRange(8, 12))).isFalse();
        assertThat(file.isSourceRangeLiteral(TextRange.point(12))).isTrue();
        assertThat(file.rawSpansSpanning(new TextRange(8, 12)))
                .containsExactly(file.getRawSpans().get(0), file.getRawSpans().get(1));
        assertThat(file.rawSpansSpanning(new TextRange(25, 25))).isEmpty();
    }

    @Test
    @DisplayName("未经模板处理的文件")
    void testFromString() {
        TemplatedFile plain = TemplatedFile.fromString("SELECT 1", "plain.sql");

        assertThat(plain.getRenderedText()).isEqualTo("SELECT 1");
        assertThat(plain.getSlices()).containsExactly(MappingSlice.of(SpanKind.LITERAL, 0, 8, 0, 8));
        assertThat(plain.sourceOnlySpans()).isEmpty();
        assertThat(TemplatedFile.fromString("", null).getSlices()).isEmpty();
    }

    @Test
    @DisplayName("切片不连续时构造失败")
    void testConsistencyCheck() {
        assertThatThrownBy(() -> new TemplatedFile("abc", "broken.sql", "abc",
                List.of(new RawSpan("abc", SpanKind.LITERAL, 0)),
                List.of(MappingSlice.of(SpanKind.LITERAL, 0, 1, 0, 1),
                        MappingSlice.of(SpanKind.LITERAL, 2, 3, 1, 2))))
                .isInstanceOf(SliceConsistencyException.class)
                .hasMessageContaining("broken.sql")
                .hasMessageContaining("source contiguity");

        assertThatThrownBy(() -> new TemplatedFile("{{#a}}", "block.sql", "x",
                List.of(new RawSpan("{{#a}}", SpanKind.BLOCK_START, 0)),
                List.of(MappingSlice.of(SpanKind.BLOCK_START, 0, 6, 0, 1))))
                .isInstanceOf(SliceConsistencyException.class)
                .hasMessageContaining("rendered width");

        /* 块标记被并入一条宽切片 */
        assertThatThrownBy(() -> new TemplatedFile("{{a}}{{#s}}{{b}}", "swallowed.sql", "12",
                List.of(new RawSpan("{{a}}", SpanKind.TEMPLATED, 0),
                        new RawSpan("{{#s}}", SpanKind.BLOCK_START, 5),
                        new RawSpan("{{b}}", SpanKind.TEMPLATED, 11)),
                List.of(MappingSlice.of(SpanKind.TEMPLATED, 0, 16, 0, 2))))
                .isInstanceOf(SliceConsistencyException.class)
                .hasMessageContaining("no zero-width slice");

        assertThatThrownBy(() -> new TemplatedFile("abc", "short.sql", "abc",
                List.of(new RawSpan("abc", SpanKind.LITERAL, 0)),
                List.of(MappingSlice.of(SpanKind.LITERAL, 0, 3, 0, 2))))
                .isInstanceOf(SliceConsistencyException.class);
    }

    @Test
    @DisplayName("JSON 输出")
    void testJson() {
        String json = TemplatedFileJson.toJson(file);

        assertThat(json).startsWith("{\"fileName\":\"test.sql\"");
        assertThat(json).contains("\"kind\":\"templated\"");
        assertThat(json).contains("\"renderedText\":\"01234\\n6789x\\nfo\\nbarss\"");
        assertThat(json).doesNotContain("sourceLines");
    }
}
