package com.chih.JSlice.core.spi;

import com.chih.JSlice.core.domain.RawSpan;

import java.util.List;

/**
 * 原始模板词法扫描器
 * <p>
 * 实现必须是纯函数：单次扫描、无状态、不丢字符。
 * 任何无法识别的字符都归入字面量片段，因此扫描本身永远不会失败。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public interface RawLexer {

    /**
     * @param rawText 原始模板文本
     * @return 按源码顺序排列、首尾相接的片段；空文本返回空列表
     */
    List<RawSpan> lex(String rawText);
}
