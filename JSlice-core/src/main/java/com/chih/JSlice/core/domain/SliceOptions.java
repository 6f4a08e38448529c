package com.chih.JSlice.core.domain;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 模板处理选项
 * <p>
 * 既可通过 YAML / JSON 反序列化得到，也可在 Spring 中由 {@code j-slice.*} 属性转换而来。
 * </p>
 *
 * <pre>{@code
 * templater: mustache
 * unwrap-wrapped-queries: true
 * ignore-templating: false
 * context:
 *   table: orders
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
@JsonNaming(PropertyNamingStrategies.KebabCaseStrategy.class)
public class SliceOptions {

    /**
     * 模板引擎名称：mustache / python / placeholder / raw
     */
    private String templater = "mustache";

    /**
     * 渲染结果被额外包裹（例如外层 SELECT）时，是否剥离包裹后重新对齐
     */
    @JsonAlias("unwrap_wrapped_queries")
    private boolean unwrapWrappedQueries = true;

    /**
     * 未定义变量不再记录，改为渲染出由变量名派生的占位文本
     */
    @JsonAlias("ignore_templating")
    private boolean ignoreTemplating = false;

    private Map<String, Object> context = new LinkedHashMap<>();

    // placeholder 引擎专用，二者只能取其一
    @JsonAlias("param_style")
    private String paramStyle;
    @JsonAlias("param_regex")
    private String paramRegex;

    public String getTemplater() {
        return templater;
    }

    public void setTemplater(String templater) {
        this.templater = templater;
    }

    public boolean isUnwrapWrappedQueries() {
        return unwrapWrappedQueries;
    }

    public void setUnwrapWrappedQueries(boolean unwrapWrappedQueries) {
        this.unwrapWrappedQueries = unwrapWrappedQueries;
    }

    public boolean isIgnoreTemplating() {
        return ignoreTemplating;
    }

    public void setIgnoreTemplating(boolean ignoreTemplating) {
        this.ignoreTemplating = ignoreTemplating;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public void setContext(Map<String, Object> context) {
        this.context = context == null ? new LinkedHashMap<>() : new LinkedHashMap<>(context);
    }

    public String getParamStyle() {
        return paramStyle;
    }

    public void setParamStyle(String paramStyle) {
        this.paramStyle = paramStyle;
    }

    public String getParamRegex() {
        return paramRegex;
    }

    public void setParamRegex(String paramRegex) {
        this.paramRegex = paramRegex;
    }

    @Override
    public String toString() {
        return "SliceOptions{templater='" + templater + "', unwrapWrappedQueries=" + unwrapWrappedQueries
                + ", ignoreTemplating=" + ignoreTemplating + ", context=" + context.keySet()
                + ", paramStyle='" + paramStyle + "', paramRegex='" + paramRegex + "'}";
    }
}
