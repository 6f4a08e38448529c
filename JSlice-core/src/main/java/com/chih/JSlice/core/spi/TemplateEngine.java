package com.chih.JSlice.core.spi;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * 模板引擎 SPI 接口
 * 允许用户替换底层的渲染逻辑，每种引擎自带与其语法匹配的词法扫描器
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public interface TemplateEngine {

    /**
     * 引擎名称，与配置中的 templater 取值对应
     */
    String name();

    /**
     * 与引擎语法一致的词法扫描器
     */
    RawLexer lexer();

    /**
     * 模板中引用到的根变量名
     * <p>
     * 调用方据此为上下文中缺失的名称预先放入占位值，从而追踪未定义变量。
     * </p>
     *
     * @param template 原始模板文本
     * @return 根变量名集合，默认不追踪
     */
    default Set<String> referencedNames(String template) {
        return Collections.emptySet();
    }

    /**
     * 渲染模板
     *
     * @param template 原始模板文本
     * @param context 变量上下文（可能包含未定义变量的占位值）
     * @return 渲染后的字符串
     * @throws com.chih.JSlice.core.exception.TemplateSyntaxException 模板语法错误
     * @throws com.chih.JSlice.core.exception.TemplateRenderException 其余渲染失败
     */
    String render(String template, Map<String, Object> context);
}
