package com.chih.JSlice.core.exception;

/**
 * 模板语法错误，例如未闭合的表达式定界符
 */
public class TemplateSyntaxException extends TemplateRenderException {

    public TemplateSyntaxException(String message, int lineNo, int linePos) {
        super(message, lineNo, linePos, null);
    }

    public TemplateSyntaxException(String message, int lineNo, int linePos, Throwable cause) {
        super(message, lineNo, linePos, cause);
    }
}
