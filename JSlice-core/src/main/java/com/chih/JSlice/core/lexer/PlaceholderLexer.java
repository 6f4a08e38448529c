package com.chih.JSlice.core.lexer;

import com.chih.JSlice.core.domain.RawSpan;
import com.chih.JSlice.core.domain.SpanKind;
import com.chih.JSlice.core.spi.RawLexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 参数占位符词法扫描：正则命中的部分为模板表达式，其余为字面量
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public class PlaceholderLexer implements RawLexer {

    static final String PARAM_GROUP = "paramName";

    private final Pattern pattern;
    private final boolean named;

    /**
     * 扫描出的一个参数
     *
     * @param span 占位符片段
     * @param name 参数名；无名参数为从 1 开始的序号
     */
    public record Parameter(RawSpan span, String name) {
    }

    public PlaceholderLexer(PlaceholderStyle style) {
        this(style.pattern());
    }

    public PlaceholderLexer(Pattern pattern) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.named = pattern.pattern().contains("(?<" + PARAM_GROUP + ">");
    }

    /**
     * 把 Python 风格的命名分组 {@code (?P<param_name>...)} 转成 Java 写法
     */
    public static Pattern compileCustom(String regex) {
        String converted = regex.replace("(?P<", "(?<").replace("(?<param_name>", "(?<" + PARAM_GROUP + ">");
        return Pattern.compile(converted);
    }

    @Override
    public List<RawSpan> lex(String rawText) {
        List<RawSpan> spans = new ArrayList<>();
        scan(rawText, spans);
        return spans;
    }

    public List<Parameter> parameters(String rawText) {
        return scan(rawText, new ArrayList<>());
    }

    private List<Parameter> scan(String rawText, List<RawSpan> spans) {
        List<Parameter> parameters = new ArrayList<>();
        Matcher matcher = pattern.matcher(rawText);
        int literalStart = 0;
        int counter = 1;
        while (matcher.find()) {
            if (matcher.end() == matcher.start()) {
                continue;
            }
            if (matcher.start() > literalStart) {
                spans.add(new RawSpan(rawText.substring(literalStart, matcher.start()), SpanKind.LITERAL, literalStart));
            }
            RawSpan span = new RawSpan(matcher.group(), SpanKind.TEMPLATED, matcher.start());
            spans.add(span);
            String name = named && matcher.group(PARAM_GROUP) != null
                    ? matcher.group(PARAM_GROUP)
                    : String.valueOf(counter++);
            parameters.add(new Parameter(span, name));
            literalStart = matcher.end();
        }
        if (literalStart < rawText.length()) {
            spans.add(new RawSpan(rawText.substring(literalStart), SpanKind.LITERAL, literalStart));
        }
        return parameters;
    }
}
