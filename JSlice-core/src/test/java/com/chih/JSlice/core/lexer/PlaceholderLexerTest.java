package com.chih.JSlice.core.lexer;

import com.chih.JSlice.core.domain.RawSpan;
import com.chih.JSlice.core.domain.SpanKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PlaceholderLexer 测试")
class PlaceholderLexerTest {

    @Test
    @DisplayName("colon 风格")
    void testColonStyle() {
        PlaceholderLexer lexer = new PlaceholderLexer(PlaceholderStyle.COLON);
        String raw = "SELECT * FROM t WHERE a = :a AND b = :b";

        List<RawSpan> spans = lexer.lex(raw);

        assertThat(spans).extracting(RawSpan::getKind).containsExactly(
                SpanKind.LITERAL, SpanKind.TEMPLATED, SpanKind.LITERAL, SpanKind.TEMPLATED);
        assertThat(lexer.parameters(raw)).extracting(PlaceholderLexer.Parameter::name).containsExactly("a", "b");
    }

    @Test
    @DisplayName("无名参数按出现顺序编号")
    void testQuestionMarkStyle() {
        PlaceholderLexer lexer = new PlaceholderLexer(PlaceholderStyle.QUESTION_MARK);

        assertThat(lexer.parameters("a = ? AND b = ?"))
                .extracting(PlaceholderLexer.Parameter::name)
                .containsExactly("1", "2");
    }

    @Test
    @DisplayName("其他内置风格")
    void testOtherStyles() {
        assertThat(new PlaceholderLexer(PlaceholderStyle.PYFORMAT).parameters("x = %(name)s"))
                .extracting(PlaceholderLexer.Parameter::name).containsExactly("name");
        assertThat(new PlaceholderLexer(PlaceholderStyle.DOLLAR).parameters("x = ${name} AND y = $other"))
                .extracting(PlaceholderLexer.Parameter::name).containsExactly("name", "other");
        assertThat(new PlaceholderLexer(PlaceholderStyle.NUMERIC_DOLLAR).parameters("x = $1"))
                .extracting(PlaceholderLexer.Parameter::name).containsExactly("1");
        assertThat(new PlaceholderLexer(PlaceholderStyle.FLYWAY_VAR).parameters("FROM ${schema:tbl}"))
                .extracting(PlaceholderLexer.Parameter::name).containsExactly("schema:tbl");
        assertThat(new PlaceholderLexer(PlaceholderStyle.PERCENT).parameters("x = %s"))
                .extracting(PlaceholderLexer.Parameter::name).containsExactly("1");
    }

    @Test
    @DisplayName("自定义正则支持 Python 风格命名分组")
    void testCustomRegex() {
        PlaceholderLexer lexer = new PlaceholderLexer(PlaceholderLexer.compileCustom("@(?P<param_name>\\w+)"));

        List<RawSpan> spans = lexer.lex("WHERE id = @id");

        assertThat(spans).containsExactly(
                new RawSpan("WHERE id = ", SpanKind.LITERAL, 0),
                new RawSpan("@id", SpanKind.TEMPLATED, 11));
        assertThat(lexer.parameters("WHERE id = @id")).extracting(PlaceholderLexer.Parameter::name).containsExactly("id");
    }

    @Test
    @DisplayName("风格名称解析")
    void testStyleFromName() {
        assertThat(PlaceholderStyle.fromName("colon_nospaces")).contains(PlaceholderStyle.COLON_NOSPACES);
        assertThat(PlaceholderStyle.fromName("Question-Mark")).contains(PlaceholderStyle.QUESTION_MARK);
        assertThat(PlaceholderStyle.fromName("nope")).isEmpty();
        assertThat(PlaceholderStyle.fromName(null)).isEmpty();
    }
}
