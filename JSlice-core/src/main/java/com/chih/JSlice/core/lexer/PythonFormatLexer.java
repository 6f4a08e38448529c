package com.chih.JSlice.core.lexer;

import com.chih.JSlice.core.domain.RawSpan;
import com.chih.JSlice.core.domain.SpanKind;
import com.chih.JSlice.core.spi.RawLexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Python {@code str.format} 风格的词法扫描
 * <p>
 * <code>{field}</code> 为模板表达式（字段内允许嵌套花括号，例如 <code>{x:{width}}</code>），
 * <code>{{</code> 与 <code>}}</code> 为转义；落单的花括号按字面量处理，由渲染阶段报错。
 * </p>
 *
 * <pre>
 * "foo {bar} z {{ y"  -&gt;  literal "foo ", templated "{bar}", literal " z ", escaped "{{", literal " y"
 * </pre>
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public class PythonFormatLexer implements RawLexer {

    @Override
    public List<RawSpan> lex(String rawText) {
        List<RawSpan> spans = new ArrayList<>();
        int literalStart = 0;
        int i = 0;
        int n = rawText.length();
        while (i < n) {
            char c = rawText.charAt(i);
            if (c == '{' || c == '}') {
                if (i + 1 < n && rawText.charAt(i + 1) == c) {
                    addLiteral(spans, rawText, literalStart, i);
                    spans.add(new RawSpan(rawText.substring(i, i + 2), SpanKind.ESCAPED, i));
                    i += 2;
                    literalStart = i;
                    continue;
                }
                if (c == '{') {
                    int fieldEnd = matchingBrace(rawText, i);
                    if (fieldEnd < 0) {
                        // 未闭合：剩余部分全部是字面量
                        break;
                    }
                    addLiteral(spans, rawText, literalStart, i);
                    spans.add(new RawSpan(rawText.substring(i, fieldEnd), SpanKind.TEMPLATED, i));
                    i = fieldEnd;
                    literalStart = i;
                    continue;
                }
            }
            i++;
        }
        addLiteral(spans, rawText, literalStart, n);
        return spans;
    }

    /**
     * 字段名的根部分：<code>{user.name!r:&gt;10}</code> 取 <code>user</code>；位置参数（空或纯数字）返回空串
     */
    public static String rootName(String field) {
        String inner = field.substring(1, field.length() - 1);
        int end = inner.length();
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '.' || c == '[' || c == '!' || c == ':') {
                end = i;
                break;
            }
        }
        String root = inner.substring(0, end).strip();
        return root.chars().allMatch(Character::isDigit) ? "" : root;
    }

    // 返回与 start 处 '{' 匹配的 '}' 之后的位置
    static int matchingBrace(String text, int start) {
        int depth = 0;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return -1;
    }

    private static void addLiteral(List<RawSpan> spans, String text, int from, int to) {
        if (to > from) {
            spans.add(new RawSpan(text.substring(from, to), SpanKind.LITERAL, from));
        }
    }
}
