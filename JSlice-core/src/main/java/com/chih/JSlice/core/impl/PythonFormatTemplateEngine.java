package com.chih.JSlice.core.impl;

import com.chih.JSlice.core.domain.LinePosition;
import com.chih.JSlice.core.domain.RawSpan;
import com.chih.JSlice.core.domain.SpanKind;
import com.chih.JSlice.core.exception.TemplateRenderException;
import com.chih.JSlice.core.exception.TemplateSyntaxException;
import com.chih.JSlice.core.lexer.PythonFormatLexer;
import com.chih.JSlice.core.spi.RawLexer;
import com.chih.JSlice.core.spi.TemplateEngine;
import com.chih.JSlice.core.support.SourceLines;
import com.chih.JSlice.core.undefined.Sentinel;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Python {@code str.format} 风格的模板引擎
 * <p>
 * 支持的字段写法：
 * <ul>
 *   <li>{@code {name}}、{@code {user.name}}、{@code {row[0]}}、{@code {cfg[key]}}</li>
 *   <li>转换 {@code !s} / {@code !r}</li>
 *   <li>格式 {@code [[fill]align][width][.precision][type]}，type 取 {@code s d f %}</li>
 * </ul>
 * 不支持位置参数（{@code {}}、{@code {0}}）。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public class PythonFormatTemplateEngine implements TemplateEngine {

    private static final Pattern SPEC_PATTERN =
            Pattern.compile("^(?:(.)?([<>^]))?(\\d+)?(?:\\.(\\d+))?([sdf%])?$");

    private static final int DEFAULT_FLOAT_PRECISION = 6;

    private final PythonFormatLexer lexer = new PythonFormatLexer();

    @Override
    public String name() {
        return "python";
    }

    @Override
    public RawLexer lexer() {
        return lexer;
    }

    @Override
    public Set<String> referencedNames(String template) {
        Set<String> names = new LinkedHashSet<>();
        for (RawSpan span : lexer.lex(template)) {
            if (span.getKind() == SpanKind.TEMPLATED) {
                String root = PythonFormatLexer.rootName(span.getText());
                if (!root.isEmpty()) {
                    names.add(root);
                }
            }
        }
        return names;
    }

    @Override
    public String render(String template, Map<String, Object> context) {
        List<RawSpan> spans = lexer.lex(template);
        StringBuilder out = new StringBuilder(template.length());
        for (RawSpan span : spans) {
            switch (span.getKind()) {
                case ESCAPED -> out.append(span.getText().charAt(0));
                case TEMPLATED -> out.append(renderField(template, span, context));
                default -> {
                    checkStrayBraces(template, span);
                    out.append(span.getText());
                }
            }
        }
        return out.toString();
    }

    private static void checkStrayBraces(String template, RawSpan span) {
        String text = span.getText();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{' || c == '}') {
                LinePosition position = SourceLines.positionIn(template, span.getSourceOffset() + i);
                String message = c == '{'
                        ? "expected '}' before end of string"
                        : "Single '}' encountered in format string";
                throw new TemplateSyntaxException(message, position.line(), position.position());
            }
        }
    }

    private String renderField(String template, RawSpan span, Map<String, Object> context) {
        LinePosition position = SourceLines.positionIn(template, span.getSourceOffset());
        String text = span.getText();
        String inner = text.substring(1, text.length() - 1);

        int nameEnd = fieldNameEnd(inner);
        String fieldName = inner.substring(0, nameEnd);
        char conversion = 0;
        String spec = "";
        int rest = nameEnd;
        if (rest < inner.length() && inner.charAt(rest) == '!') {
            if (rest + 1 >= inner.length()) {
                throw new TemplateSyntaxException("end of string while looking for conversion specifier",
                        position.line(), position.position());
            }
            conversion = inner.charAt(rest + 1);
            rest += 2;
            if (rest < inner.length() && inner.charAt(rest) != ':') {
                throw new TemplateSyntaxException("expected ':' after conversion specifier",
                        position.line(), position.position());
            }
        }
        if (rest < inner.length() && inner.charAt(rest) == ':') {
            spec = inner.substring(rest + 1);
            if (spec.indexOf('{') >= 0) {
                // 嵌套字段：{value:{width}}
                spec = render(spec, context);
            }
        }

        Object value = resolve(fieldName, context, position);
        switch (conversion) {
            case 0 -> {
            }
            case 's' -> value = stringify(value);
            case 'r' -> value = repr(value);
            default -> throw new TemplateRenderException(
                    "Unknown conversion specifier " + conversion, position.line(), position.position(), null);
        }
        try {
            return format(value, spec);
        } catch (IllegalArgumentException e) {
            throw new TemplateRenderException(e.getMessage(), position.line(), position.position(), e);
        }
    }

    // 字段名在第一个位于方括号外的 '!' 或 ':' 处结束
    private static int fieldNameEnd(String inner) {
        boolean inBracket = false;
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '[') {
                inBracket = true;
            } else if (c == ']') {
                inBracket = false;
            } else if (!inBracket && (c == '!' || c == ':')) {
                return i;
            }
        }
        return inner.length();
    }

    private Object resolve(String fieldName, Map<String, Object> context, LinePosition position) {
        int i = 0;
        while (i < fieldName.length() && fieldName.charAt(i) != '.' && fieldName.charAt(i) != '[') {
            i++;
        }
        String root = fieldName.substring(0, i).strip();
        if (root.isEmpty() || root.chars().allMatch(Character::isDigit)) {
            throw new TemplateRenderException("Positional format fields are not supported: {" + fieldName + "}",
                    position.line(), position.position(), null);
        }
        if (!context.containsKey(root)) {
            throw new TemplateRenderException("Undefined template variable: '" + root + "'",
                    position.line(), position.position(), null);
        }
        Object value = context.get(root);

        while (i < fieldName.length()) {
            char c = fieldName.charAt(i);
            if (c == '.') {
                int end = i + 1;
                while (end < fieldName.length() && fieldName.charAt(end) != '.' && fieldName.charAt(end) != '[') {
                    end++;
                }
                value = attribute(value, fieldName.substring(i + 1, end), position);
                i = end;
            } else {
                int close = fieldName.indexOf(']', i);
                if (close < 0) {
                    throw new TemplateSyntaxException("Missing ']' in format string", position.line(), position.position());
                }
                value = item(value, fieldName.substring(i + 1, close), position);
                i = close + 1;
            }
        }
        return value;
    }

    private static Object attribute(Object target, String attribute, LinePosition position) {
        if (target instanceof Sentinel sentinel) {
            return sentinel.getAttribute(attribute);
        }
        if (target instanceof Map<?, ?> map) {
            if (!map.containsKey(attribute)) {
                throw new TemplateRenderException("Object has no attribute '" + attribute + "'",
                        position.line(), position.position(), null);
            }
            return map.get(attribute);
        }
        if (target == null) {
            throw new TemplateRenderException("'None' object has no attribute '" + attribute + "'",
                    position.line(), position.position(), null);
        }
        return readProperty(target, attribute, position);
    }

    private static Object item(Object target, String key, LinePosition position) {
        if (target instanceof Sentinel sentinel) {
            return sentinel.getAttribute(key);
        }
        boolean numeric = !key.isEmpty() && key.chars().allMatch(Character::isDigit);
        if (target instanceof List<?> list && numeric) {
            int index = Integer.parseInt(key);
            if (index >= list.size()) {
                throw new TemplateRenderException("list index out of range: " + index,
                        position.line(), position.position(), null);
            }
            return list.get(index);
        }
        if (target instanceof Map<?, ?> map) {
            if (map.containsKey(key)) {
                return map.get(key);
            }
            if (numeric && map.containsKey(Integer.valueOf(key))) {
                return map.get(Integer.valueOf(key));
            }
            throw new TemplateRenderException("Key not found: '" + key + "'", position.line(), position.position(), null);
        }
        throw new TemplateRenderException("Object is not subscriptable with [" + key + "]",
                position.line(), position.position(), null);
    }

    private static Object readProperty(Object target, String property, LinePosition position) {
        Class<?> type = target.getClass();
        String suffix = property.isEmpty() ? property
                : Character.toUpperCase(property.charAt(0)) + property.substring(1);
        for (String candidate : new String[]{"get" + suffix, "is" + suffix, property}) {
            try {
                Method method = type.getMethod(candidate);
                return method.invoke(target);
            } catch (NoSuchMethodException e) {
                // 尝试下一种写法
            } catch (IllegalAccessException | InvocationTargetException e) {
                throw new TemplateRenderException("Failed to read attribute '" + property + "'",
                        position.line(), position.position(), e);
            }
        }
        try {
            Field field = type.getField(property);
            return field.get(target);
        } catch (NoSuchFieldException | IllegalAccessException e) {
            throw new TemplateRenderException("Object of type " + type.getSimpleName()
                    + " has no attribute '" + property + "'", position.line(), position.position(), e);
        }
    }

    static String stringify(Object value) {
        if (value instanceof Sentinel sentinel) {
            return sentinel.toText();
        }
        if (value == null) {
            return "None";
        }
        if (value instanceof Boolean bool) {
            return bool ? "True" : "False";
        }
        return String.valueOf(value);
    }

    private static String repr(Object value) {
        if (value instanceof CharSequence) {
            return "'" + value + "'";
        }
        return stringify(value);
    }

    /**
     * 按格式说明输出单个值
     *
     * @throws IllegalArgumentException 格式说明无效或与值的类型不匹配
     */
    static String format(Object value, String spec) {
        if (spec.isEmpty()) {
            return stringify(value);
        }
        Matcher matcher = SPEC_PATTERN.matcher(spec);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid format specifier '" + spec + "'");
        }
        String fillGroup = matcher.group(1);
        String alignGroup = matcher.group(2);
        int width = matcher.group(3) == null ? 0 : Integer.parseInt(matcher.group(3));
        Integer precision = matcher.group(4) == null ? null : Integer.valueOf(matcher.group(4));
        String type = matcher.group(5);

        boolean number = value instanceof Number && !(value instanceof Boolean);
        String body;
        if (number) {
            body = formatNumber((Number) value, precision, type);
        } else {
            if (type != null && !"s".equals(type)) {
                throw new IllegalArgumentException("Unknown format code '" + type + "' for value of type "
                        + (value == null ? "None" : value.getClass().getSimpleName()));
            }
            body = stringify(value);
            if (precision != null && body.length() > precision) {
                body = body.substring(0, precision);
            }
        }

        char fill = fillGroup == null ? ' ' : fillGroup.charAt(0);
        char align = alignGroup == null ? (number ? '>' : '<') : alignGroup.charAt(0);
        return pad(body, width, fill, align);
    }

    private static String formatNumber(Number value, Integer precision, String type) {
        if (type == null) {
            if (precision == null) {
                return String.valueOf(value);
            }
            return new BigDecimal(value.toString()).round(new MathContext(Math.max(1, precision)))
                    .stripTrailingZeros().toPlainString();
        }
        int digits = precision == null ? DEFAULT_FLOAT_PRECISION : precision;
        return switch (type) {
            case "d" -> {
                if (!isIntegral(value)) {
                    throw new IllegalArgumentException("Unknown format code 'd' for object of type float");
                }
                if (precision != null) {
                    throw new IllegalArgumentException("Precision not allowed in integer format specifier");
                }
                yield value.toString();
            }
            case "f" -> String.format(Locale.ROOT, "%." + digits + "f", value.doubleValue());
            case "%" -> String.format(Locale.ROOT, "%." + digits + "f", value.doubleValue() * 100) + "%";
            default -> throw new IllegalArgumentException("Unknown format code '" + type + "' for a number");
        };
    }

    private static boolean isIntegral(Number value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }

    private static String pad(String body, int width, char fill, char align) {
        int missing = width - body.length();
        if (missing <= 0) {
            return body;
        }
        String left;
        String right;
        switch (align) {
            case '>' -> {
                left = repeat(fill, missing);
                right = "";
            }
            case '^' -> {
                left = repeat(fill, missing / 2);
                right = repeat(fill, missing - missing / 2);
            }
            default -> {
                left = "";
                right = repeat(fill, missing);
            }
        }
        return left + body + right;
    }

    private static String repeat(char c, int count) {
        return String.valueOf(c).repeat(count);
    }
}
