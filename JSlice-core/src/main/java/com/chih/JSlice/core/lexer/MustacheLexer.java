package com.chih.JSlice.core.lexer;

import com.chih.JSlice.core.domain.RawSpan;
import com.chih.JSlice.core.domain.SpanKind;
import com.chih.JSlice.core.spi.RawLexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Mustache 语法词法扫描
 * <p>
 * 标签分类：
 * <ul>
 *   <li>{@code {{name}}}、{@code {{{name}}}}、{@code {{&name}}}、{@code {{> partial}}}：模板表达式</li>
 *   <li>{@code {{#name}}}、{@code {{^name}}}、{@code {{$name}}}、{@code {{<parent}}}：块开始</li>
 *   <li>{@code {{/name}}}：块结束</li>
 *   <li>{@code {{! ...}}} 注释，{@code {{=<% %>=}}} 切换定界符（同样只存在于源码）</li>
 * </ul>
 * 独占一行的块标签 / 注释在渲染时会连同缩进与行尾换行一起被移除，
 * 因此这部分空白归入标签片段本身。未闭合的标签按字面量处理。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public class MustacheLexer implements RawLexer {

    private static final String DEFAULT_OPEN = "{{";
    private static final String DEFAULT_CLOSE = "}}";
    private static final String SIGILS = "#^$</!=&{>";

    /**
     * 一个标签及其解析结果
     *
     * @param span 标签片段（可能包含独占行的空白）
     * @param sigil 标签类型符号，普通变量为 0
     * @param name 标签内的名称，已去除首尾空白
     */
    public record Tag(RawSpan span, char sigil, String name) {
    }

    @Override
    public List<RawSpan> lex(String rawText) {
        List<RawSpan> spans = new ArrayList<>();
        scan(rawText, spans, null);
        return spans;
    }

    /**
     * 扫描出所有标签
     */
    public List<Tag> tags(String rawText) {
        List<Tag> tags = new ArrayList<>();
        scan(rawText, new ArrayList<>(), tags);
        return tags;
    }

    private void scan(String raw, List<RawSpan> spans, List<Tag> tags) {
        String open = DEFAULT_OPEN;
        String close = DEFAULT_CLOSE;
        int literalStart = 0;
        int cursor = 0;

        while (cursor < raw.length()) {
            int tagStart = raw.indexOf(open, cursor);
            if (tagStart < 0) {
                break;
            }
            int contentStart = tagStart + open.length();
            boolean triple = raw.startsWith("{", contentStart);
            String closing = triple ? "}" + close : close;
            int closeIdx = raw.indexOf(closing, contentStart + (triple ? 1 : 0));
            if (closeIdx < 0) {
                break;
            }
            int tagEnd = closeIdx + closing.length();
            String content = raw.substring(contentStart, closeIdx).strip();
            char sigil = content.isEmpty() || SIGILS.indexOf(content.charAt(0)) < 0 ? 0 : content.charAt(0);
            SpanKind kind = classify(sigil);
            String name = nameOf(content, sigil);

            int spanStart = tagStart;
            int spanEnd = tagEnd;
            if (kind.isSourceOnly()) {
                int lineStart = raw.lastIndexOf('\n', tagStart - 1) + 1;
                int lineEnd = standaloneLineEnd(raw, tagEnd);
                if (lineStart >= cursor && isBlank(raw, lineStart, tagStart) && lineEnd >= 0) {
                    spanStart = lineStart;
                    spanEnd = lineEnd;
                }
            }

            if (spanStart > literalStart) {
                spans.add(new RawSpan(raw.substring(literalStart, spanStart), SpanKind.LITERAL, literalStart));
            }
            RawSpan tagSpan = new RawSpan(raw.substring(spanStart, spanEnd), kind, spanStart);
            spans.add(tagSpan);
            if (tags != null) {
                tags.add(new Tag(tagSpan, sigil, name));
            }

            if (sigil == '=') {
                String[] delimiters = parseDelimiters(content);
                if (delimiters != null) {
                    open = delimiters[0];
                    close = delimiters[1];
                }
            }
            literalStart = spanEnd;
            cursor = spanEnd;
        }
        if (literalStart < raw.length()) {
            spans.add(new RawSpan(raw.substring(literalStart), SpanKind.LITERAL, literalStart));
        }
    }

    private static SpanKind classify(char sigil) {
        return switch (sigil) {
            case '#', '^', '$', '<' -> SpanKind.BLOCK_START;
            case '/' -> SpanKind.BLOCK_END;
            case '!', '=' -> SpanKind.COMMENT;
            default -> SpanKind.TEMPLATED;
        };
    }

    private static String nameOf(String content, char sigil) {
        String name = switch (sigil) {
            case '#', '^', '$', '<', '/', '!', '&', '>' -> content.substring(1);
            case '{' -> content.endsWith("}") ? content.substring(1, content.length() - 1) : content.substring(1);
            case '=' -> "";
            default -> content;
        };
        return name.strip();
    }

    /**
     * 标签之后到行尾只有空白时，返回行尾换行符之后的位置；否则返回 -1
     */
    private static int standaloneLineEnd(String raw, int from) {
        int i = from;
        while (i < raw.length() && (raw.charAt(i) == ' ' || raw.charAt(i) == '\t')) {
            i++;
        }
        if (i == raw.length()) {
            return i;
        }
        if (raw.charAt(i) == '\n') {
            return i + 1;
        }
        if (raw.startsWith("\r\n", i)) {
            return i + 2;
        }
        return -1;
    }

    private static boolean isBlank(String raw, int from, int to) {
        for (int i = from; i < to; i++) {
            char c = raw.charAt(i);
            if (c != ' ' && c != '\t') {
                return false;
            }
        }
        return true;
    }

    // {{=<% %>=}} -> ["<%", "%>"]
    private static String[] parseDelimiters(String content) {
        if (content.length() < 2 || !content.endsWith("=")) {
            return null;
        }
        String[] parts = content.substring(1, content.length() - 1).strip().split("\\s+");
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            return null;
        }
        return parts;
    }
}
