package com.chih.JSlice.spring;

import com.chih.JSlice.core.domain.SliceOptions;
import com.chih.JSlice.core.engine.TemplaterCache;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 模板切片配置
 *
 * <pre>{@code
 * j-slice:
 *   templater: placeholder
 *   param-style: colon
 *   context:
 *     schema: analytics
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2026/10/16
 */
@ConfigurationProperties(prefix = "j-slice")
public class JSliceProperties {

    /**
     * 模板引擎：mustache / python / placeholder / raw
     */
    private String templater = "mustache";

    /**
     * 渲染结果被额外包裹时，剥离包裹后重新对齐
     */
    private boolean unwrapWrappedQueries = true;

    /**
     * 未定义变量渲染为由名称派生的占位文本，不再记录
     */
    private boolean ignoreTemplating = false;

    /**
     * 渲染上下文
     */
    private Map<String, Object> context = new LinkedHashMap<>();

    private String paramStyle;

    private String paramRegex;

    /**
     * TemplaterCache 最大条目数
     */
    private long cacheMaximumSize = TemplaterCache.DEFAULT_MAXIMUM_SIZE;

    /**
     * TemplaterCache 条目闲置过期时间 (分钟)
     */
    private long cacheExpireMinutes = TemplaterCache.DEFAULT_EXPIRE_MINUTES;

    public SliceOptions toOptions() {
        SliceOptions options = new SliceOptions();
        options.setTemplater(templater);
        options.setUnwrapWrappedQueries(unwrapWrappedQueries);
        options.setIgnoreTemplating(ignoreTemplating);
        options.setContext(context);
        options.setParamStyle(paramStyle);
        options.setParamRegex(paramRegex);
        return options;
    }

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
        this.context = context;
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

    public long getCacheMaximumSize() {
        return cacheMaximumSize;
    }

    public void setCacheMaximumSize(long cacheMaximumSize) {
        this.cacheMaximumSize = cacheMaximumSize;
    }

    public long getCacheExpireMinutes() {
        return cacheExpireMinutes;
    }

    public void setCacheExpireMinutes(long cacheExpireMinutes) {
        this.cacheExpireMinutes = cacheExpireMinutes;
    }
}
