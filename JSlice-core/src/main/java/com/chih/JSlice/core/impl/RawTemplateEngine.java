package com.chih.JSlice.core.impl;

import com.chih.JSlice.core.domain.RawSpan;
import com.chih.JSlice.core.domain.SpanKind;
import com.chih.JSlice.core.spi.RawLexer;
import com.chih.JSlice.core.spi.TemplateEngine;

import java.util.List;
import java.util.Map;

/**
 * 不做任何模板处理，原样输出
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public class RawTemplateEngine implements TemplateEngine {

    private static final RawLexer LEXER = rawText -> rawText.isEmpty()
            ? List.of()
            : List.of(new RawSpan(rawText, SpanKind.LITERAL, 0));

    @Override
    public String name() {
        return "raw";
    }

    @Override
    public RawLexer lexer() {
        return LEXER;
    }

    @Override
    public String render(String template, Map<String, Object> context) {
        return template;
    }
}
