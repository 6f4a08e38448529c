package com.chih.JSlice.core.impl;

import com.chih.JSlice.core.exception.TemplateSyntaxException;
import com.chih.JSlice.core.spi.CompiledTemplate;
import com.chih.JSlice.core.undefined.UndefinedSet;
import com.chih.JSlice.core.undefined.UndefinedTracker;
import com.github.mustachejava.MustacheException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Mustache 引擎测试")
class MustacheTemplateEngineTest {

    private final MustacheTemplateEngine engine = new MustacheTemplateEngine();

    @Test
    @DisplayName("变量替换，不做 HTML 转义")
    void testRenderWithoutEscaping() {
        String result = engine.render("SELECT {{col}} FROM t WHERE name = '{{v}}'",
                Map.of("col", "a", "v", "<b> & \"c\""));

        assertThat(result).isEqualTo("SELECT a FROM t WHERE name = '<b> & \"c\"'");
    }

    @Test
    @DisplayName("循环区块")
    void testSection() {
        String result = engine.render("{{#cols}}{{name}},{{/cols}}",
                Map.of("cols", List.of(Map.of("name", "a"), Map.of("name", "b"))));

        assertThat(result).isEqualTo("a,b,");
    }

    @Test
    @DisplayName("子模板从加载器读取并被记录")
    void testPartials() {
        MustacheTemplateEngine withPartials = new MustacheTemplateEngine(
                name -> "from_clause".equals(name) ? "FROM {{tbl}}" : null);

        CompiledTemplate compiled = withPartials.compile("SELECT 1 {{> from_clause}}", "query.sql");

        assertThat(compiled.getPartials()).containsExactly("from_clause");
        assertThat(withPartials.render("SELECT 1 {{> from_clause}}", Map.of("tbl", "t"))).isEqualTo("SELECT 1 FROM t");
    }

    @Test
    @DisplayName("子模板不存在")
    void testMissingPartial() {
        assertThatThrownBy(() -> engine.render("SELECT {{> missing}}", Map.of()))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("missing");
    }

    @Test
    @DisplayName("未闭合区块是语法错误")
    void testUnclosedSection() {
        assertThatThrownBy(() -> engine.render("SELECT 1\n{{#a}}x", Map.of()))
                .isInstanceOfSatisfying(TemplateSyntaxException.class,
                        e -> assertThat(e.getLineNo()).isGreaterThanOrEqualTo(1));
    }

    @Test
    @DisplayName("从异常信息中解析行号")
    void testLineOf() {
        assertThat(MustacheTemplateEngine.lineOf(new MustacheException("Failed to close 'a' tag @[query.sql:7]")))
                .isEqualTo(7);
        assertThat(MustacheTemplateEngine.lineOf(new RuntimeException("wrapper",
                new MustacheException("Improperly closed variable in query.sql:3 @[query.sql:3]")))).isEqualTo(3);
        assertThat(MustacheTemplateEngine.lineOf(new RuntimeException("no position"))).isEqualTo(1);
    }

    @Test
    @DisplayName("提取引用的根变量名")
    void testReferencedNames() {
        assertThat(engine.referencedNames("{{a}} {{#b}}{{c.d}}{{/b}} {{! x}} {{> p}} {{{e}}} {{&f}}"))
                .containsExactly("a", "b", "c", "e", "f");
    }

    @Test
    @DisplayName("未定义变量：直接访问与属性访问分别记录")
    void testUndefinedRecording() {
        UndefinedSet undefined = new UndefinedSet();
        UndefinedTracker tracker = new UndefinedTracker(false, undefined);
        String template = "{{x}}-{{x.y}}";

        String result = engine.render(template, tracker.install(Map.of(), engine.referencedNames(template)));

        assertThat(result).isEqualTo("-");
        assertThat(undefined.names()).containsExactly("x", "x.y");
    }

    @Test
    @DisplayName("未定义变量在区块中为假")
    void testUndefinedIsFalsey() {
        UndefinedSet undefined = new UndefinedSet();
        UndefinedTracker tracker = new UndefinedTracker(false, undefined);
        String template = "{{#flag}}yes{{/flag}}{{^flag}}no{{/flag}}";

        String result = engine.render(template, tracker.install(Map.of(), engine.referencedNames(template)));

        assertThat(result).isEqualTo("no");
        assertThat(undefined.names()).containsExactly("flag");
    }

    @Test
    @DisplayName("忽略模式：输出由名称派生的文本")
    void testIgnoreTemplating() {
        UndefinedTracker tracker = new UndefinedTracker(true, new UndefinedSet());
        String template = "SELECT * FROM {{schema.tbl}}{{#flag}} WHERE 1 = 1{{/flag}}";

        String result = engine.render(template, tracker.install(Map.of(), engine.referencedNames(template)));

        assertThat(result).isEqualTo("SELECT * FROM schema_tbl WHERE 1 = 1");
    }
}
