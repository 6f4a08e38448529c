package com.chih.JSlice.core.impl;

import com.chih.JSlice.core.lexer.PlaceholderLexer;
import com.chih.JSlice.core.lexer.PlaceholderStyle;
import com.chih.JSlice.core.spi.RawLexer;
import com.chih.JSlice.core.spi.TemplateEngine;
import com.chih.JSlice.core.undefined.Sentinel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * 参数占位符引擎
 * <p>
 * 用上下文中同名的值替换占位符；上下文中没有该参数时，直接输出参数名。
 * 无名参数（{@code ?}、{@code %s}）按出现顺序以 "1"、"2" ... 作为参数名。
 * </p>
 *
 * <pre>{@code
 * SELECT * FROM t WHERE id = :id   + {id: 42}  ->  SELECT * FROM t WHERE id = 42
 * SELECT * FROM t WHERE id = ?     + {}        ->  SELECT * FROM t WHERE id = 1
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public class PlaceholderTemplateEngine implements TemplateEngine {

    private static final Logger log = LoggerFactory.getLogger(PlaceholderTemplateEngine.class);

    private final PlaceholderLexer lexer;

    public PlaceholderTemplateEngine(PlaceholderLexer lexer) {
        this.lexer = Objects.requireNonNull(lexer, "lexer");
    }

    public static PlaceholderTemplateEngine forStyle(PlaceholderStyle style) {
        return new PlaceholderTemplateEngine(new PlaceholderLexer(style));
    }

    public static PlaceholderTemplateEngine forRegex(String regex) {
        return new PlaceholderTemplateEngine(new PlaceholderLexer(PlaceholderLexer.compileCustom(regex)));
    }

    @Override
    public String name() {
        return "placeholder";
    }

    @Override
    public RawLexer lexer() {
        return lexer;
    }

    @Override
    public String render(String template, Map<String, Object> context) {
        StringBuilder out = new StringBuilder(template.length());
        int cursor = 0;
        for (PlaceholderLexer.Parameter parameter : lexer.parameters(template)) {
            int start = parameter.span().getSourceOffset();
            out.append(template, cursor, start);
            String name = parameter.name();
            String replacement;
            if (context.containsKey(name)) {
                Object value = context.get(name);
                replacement = value instanceof Sentinel sentinel ? sentinel.toText() : String.valueOf(value);
            } else {
                replacement = name;
            }
            log.trace("Replacing parameter {} with '{}'", parameter.span().getText(), replacement);
            out.append(replacement);
            cursor = parameter.span().getEnd();
        }
        out.append(template, cursor, template.length());
        return out.toString();
    }
}
