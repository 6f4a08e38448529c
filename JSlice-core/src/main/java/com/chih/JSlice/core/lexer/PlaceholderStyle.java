package com.chih.JSlice.core.lexer;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 内置的参数占位符风格
 * <p>
 * 有名参数通过命名分组 {@code paramName} 捕获，无名参数（{@code ?}、{@code %s}）按出现顺序从 1 编号。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public enum PlaceholderStyle {

    /** WHERE bla = :name */
    COLON("colon", "(?<![:\\w\\x5c]):(?<paramName>\\w+)(?!:)"),
    /** WHERE bla = table:name，冒号前允许任意字符 */
    COLON_NOSPACES("colon_nospaces", "(?<!:):(?<paramName>\\w+)"),
    /** WHERE bla = :2 */
    NUMERIC_COLON("numeric_colon", "(?<![:\\w\\x5c]):(?<paramName>\\d+)"),
    /** WHERE bla = %(name)s */
    PYFORMAT("pyformat", "(?<![:\\w\\x5c])%\\((?<paramName>\\w+)\\)s"),
    /** WHERE bla = $name 或 ${name} */
    DOLLAR("dollar", "(?<![:\\w\\x5c])\\$\\{?(?<paramName>\\w+)\\}?"),
    /** WHERE bla = ${name} 或 ${schema:name} */
    FLYWAY_VAR("flyway_var", "\\$\\{(?<paramName>\\w+[:\\w]+)\\}"),
    /** WHERE bla = ? */
    QUESTION_MARK("question_mark", "(?<![:\\w\\x5c])\\?"),
    /** WHERE bla = $3 或 ${3} */
    NUMERIC_DOLLAR("numeric_dollar", "(?<![:\\w\\x5c])\\$\\{?(?<paramName>\\d+)\\}?"),
    /** WHERE bla = %s */
    PERCENT("percent", "(?<![-\\w\\x5c])%s"),
    /** WHERE bla = &s 或 &{s} */
    AMPERSAND("ampersand", "(?<!&)&\\{?(?<paramName>\\w+)\\}?");

    private final String styleName;
    private final Pattern pattern;

    PlaceholderStyle(String styleName, String regex) {
        this.styleName = styleName;
        this.pattern = Pattern.compile(regex);
    }

    public String styleName() {
        return styleName;
    }

    public Pattern pattern() {
        return pattern;
    }

    public static Optional<PlaceholderStyle> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values()).filter(style -> style.styleName.equals(normalized)).findFirst();
    }
}
