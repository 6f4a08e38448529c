package com.chih.JSlice.core.engine;

import com.chih.JSlice.core.domain.SliceOptions;
import com.chih.JSlice.core.exception.TemplaterConfigException;
import com.chih.JSlice.core.impl.MustacheTemplateEngine;
import com.chih.JSlice.core.impl.PlaceholderTemplateEngine;
import com.chih.JSlice.core.impl.PythonFormatTemplateEngine;
import com.chih.JSlice.core.impl.RawTemplateEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("模板引擎工厂测试")
class TemplateEngineFactoryTest {

    @Test
    @DisplayName("按名称创建，忽略大小写与首尾空白")
    void testCreate() {
        assertThat(TemplateEngineFactory.create(options("mustache", null, null)))
                .isInstanceOf(MustacheTemplateEngine.class);
        assertThat(TemplateEngineFactory.create(options(" Python ", null, null)))
                .isInstanceOf(PythonFormatTemplateEngine.class);
        assertThat(TemplateEngineFactory.create(options("RAW", null, null)))
                .isInstanceOf(RawTemplateEngine.class);
        assertThat(TemplateEngineFactory.create(options("placeholder", "numeric-colon", null)))
                .isInstanceOf(PlaceholderTemplateEngine.class);
    }

    @Test
    @DisplayName("自定义参数正则")
    void testPlaceholderRegex() {
        var engine = TemplateEngineFactory.create(options("placeholder", null, "@(?P<param_name>\\w+)"));

        assertThat(engine.render("WHERE id = @id", Map.of("id", 7))).isEqualTo("WHERE id = 7");
    }

    @Test
    @DisplayName("placeholder 引擎的参数配置错误")
    void testPlaceholderErrors() {
        assertThatThrownBy(() -> TemplateEngineFactory.create(options("placeholder", "colon", ":\\w+")))
                .isInstanceOf(TemplaterConfigException.class)
                .hasMessage("Both param_regex and param_style were provided to the placeholder templater");
        assertThatThrownBy(() -> TemplateEngineFactory.create(options("placeholder", null, null)))
                .isInstanceOf(TemplaterConfigException.class)
                .hasMessage("No param_regex nor param_style was provided to the placeholder templater");
        assertThatThrownBy(() -> TemplateEngineFactory.create(options("placeholder", "semicolon", null)))
                .isInstanceOf(TemplaterConfigException.class)
                .hasMessageStartingWith("Unknown param_style 'semicolon'");
        assertThatThrownBy(() -> TemplateEngineFactory.create(options("placeholder", null, "(unclosed")))
                .isInstanceOf(TemplaterConfigException.class)
                .hasMessageContaining("Invalid param_regex");
    }

    @Test
    @DisplayName("未知引擎")
    void testUnknownTemplater() {
        assertThatThrownBy(() -> TemplateEngineFactory.create(options("velocity", null, null)))
                .isInstanceOf(TemplaterConfigException.class)
                .hasMessage("Unknown templater 'velocity', expected one of [mustache, python, placeholder, raw]");
        assertThatThrownBy(() -> TemplateEngineFactory.create(options(null, null, null)))
                .isInstanceOf(TemplaterConfigException.class);
    }

    private static SliceOptions options(String templater, String paramStyle, String paramRegex) {
        SliceOptions options = new SliceOptions();
        options.setTemplater(templater);
        options.setParamStyle(paramStyle);
        options.setParamRegex(paramRegex);
        return options;
    }
}
