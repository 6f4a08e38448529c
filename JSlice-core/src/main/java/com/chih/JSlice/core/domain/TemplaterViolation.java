package com.chih.JSlice.core.domain;

/**
 * 模板处理过程中发现的问题（目前用于未定义变量）
 *
 * @author lizhiyuan
 * @since 2026/10/15
 */
public record TemplaterViolation(String message, int lineNo, int linePos) {
}
