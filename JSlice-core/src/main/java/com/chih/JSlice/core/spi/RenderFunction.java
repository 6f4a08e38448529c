package com.chih.JSlice.core.spi;

/**
 * 渲染回调：对齐引擎只通过它调用外部模板引擎
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
@FunctionalInterface
public interface RenderFunction {

    /**
     * @param candidateText 待渲染的原始文本
     * @return 渲染结果
     * @throws com.chih.JSlice.core.exception.TemplateRenderException 模板无法解析或执行
     */
    String render(String candidateText);
}
