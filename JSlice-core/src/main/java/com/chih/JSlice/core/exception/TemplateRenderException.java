package com.chih.JSlice.core.exception;

/**
 * 模板渲染失败
 * <p>
 * 无法定位出错行时使用第 1 行第 1 列作为占位。
 * </p>
 */
public class TemplateRenderException extends JSliceException {

    private final int lineNo;
    private final int linePos;

    public TemplateRenderException(String message, Throwable cause) {
        this(message, 1, 1, cause);
    }

    public TemplateRenderException(String message, int lineNo, int linePos, Throwable cause) {
        super(message, cause);
        this.lineNo = lineNo;
        this.linePos = linePos;
    }

    public int getLineNo() {
        return lineNo;
    }

    public int getLinePos() {
        return linePos;
    }
}
