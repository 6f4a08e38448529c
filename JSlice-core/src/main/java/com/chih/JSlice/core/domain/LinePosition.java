package com.chih.JSlice.core.domain;

/**
 * 行号与行内位置，均从 1 开始
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public record LinePosition(int line, int position) {
}
