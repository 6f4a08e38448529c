package com.chih.JSlice.core.engine;

import com.chih.JSlice.core.domain.SliceOptions;
import com.chih.JSlice.core.exception.TemplaterConfigException;
import com.chih.JSlice.core.impl.MustacheTemplateEngine;
import com.chih.JSlice.core.impl.PlaceholderTemplateEngine;
import com.chih.JSlice.core.impl.PythonFormatTemplateEngine;
import com.chih.JSlice.core.impl.RawTemplateEngine;
import com.chih.JSlice.core.lexer.PlaceholderStyle;
import com.chih.JSlice.core.spi.TemplateEngine;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.PatternSyntaxException;

/**
 * 按配置创建模板引擎
 *
 * @author lizhiyuan
 * @since 2026/10/15
 */
public final class TemplateEngineFactory {

    public static final List<String> SUPPORTED_TEMPLATERS = List.of("mustache", "python", "placeholder", "raw");

    private TemplateEngineFactory() {
    }

    /**
     * @throws TemplaterConfigException 引擎名称未知，或 placeholder 引擎的参数配置无效
     */
    public static TemplateEngine create(SliceOptions options) {
        String templater = options.getTemplater() == null ? "" : options.getTemplater().trim().toLowerCase(Locale.ROOT);
        return switch (templater) {
            case "mustache" -> new MustacheTemplateEngine();
            case "python" -> new PythonFormatTemplateEngine();
            case "placeholder" -> placeholder(options.getParamStyle(), options.getParamRegex());
            case "raw" -> new RawTemplateEngine();
            default -> throw new TemplaterConfigException("Unknown templater '" + options.getTemplater()
                    + "', expected one of " + SUPPORTED_TEMPLATERS);
        };
    }

    private static TemplateEngine placeholder(String paramStyle, String paramRegex) {
        boolean hasStyle = paramStyle != null && !paramStyle.isBlank();
        boolean hasRegex = paramRegex != null && !paramRegex.isEmpty();
        if (hasStyle && hasRegex) {
            throw new TemplaterConfigException(
                    "Both param_regex and param_style were provided to the placeholder templater");
        }
        if (hasRegex) {
            try {
                return PlaceholderTemplateEngine.forRegex(paramRegex);
            } catch (PatternSyntaxException e) {
                throw new TemplaterConfigException("Invalid param_regex '" + paramRegex + "'", e);
            }
        }
        if (!hasStyle) {
            throw new TemplaterConfigException(
                    "No param_regex nor param_style was provided to the placeholder templater");
        }
        PlaceholderStyle style = PlaceholderStyle.fromName(paramStyle)
                .orElseThrow(() -> new TemplaterConfigException("Unknown param_style '" + paramStyle
                        + "', expected one of " + Arrays.stream(PlaceholderStyle.values())
                        .map(PlaceholderStyle::styleName).toList()));
        return PlaceholderTemplateEngine.forStyle(style);
    }
}
