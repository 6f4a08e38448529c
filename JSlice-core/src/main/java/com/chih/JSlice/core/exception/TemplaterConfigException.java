package com.chih.JSlice.core.exception;

/**
 * 模板引擎配置无效
 */
public class TemplaterConfigException extends JSliceException {
    public TemplaterConfigException(String message) {
        super(message);
    }

    public TemplaterConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
