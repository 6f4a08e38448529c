package com.chih.JSlice.spring;

import com.chih.JSlice.core.engine.SqlTemplater;
import com.chih.JSlice.core.engine.TemplateEngineFactory;
import com.chih.JSlice.core.engine.TemplaterCache;
import com.chih.JSlice.core.impl.NoOpSliceMetrics;
import com.chih.JSlice.core.spi.SliceMetrics;
import com.chih.JSlice.core.spi.TemplateEngine;
import com.chih.JSlice.spring.metrics.MicrometerSliceMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * JSlice Spring Boot 自动配置类
 * <p>
 * 按 {@code j-slice.*} 属性创建模板引擎、{@link SqlTemplater} 与 {@link TemplaterCache}。
 * 所有 Bean 都带有 {@code @ConditionalOnMissingBean}，用户声明同类型 Bean 即可覆盖。
 * </p>
 *
 * <pre>{@code
 * j-slice:
 *   templater: python
 *   unwrap-wrapped-queries: true
 *   context:
 *     table: orders
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2026/10/16
 * @see JSliceProperties
 */
@Configuration
@EnableConfigurationProperties(JSliceProperties.class)
public class JSliceAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(JSliceAutoConfiguration.class);

    /**
     * 默认模板引擎，由 {@code j-slice.templater} 决定
     *
     * @throws com.chih.JSlice.core.exception.TemplaterConfigException 配置无效时启动失败
     */
    @Bean
    @ConditionalOnMissingBean(TemplateEngine.class)
    public TemplateEngine templateEngine(JSliceProperties properties) {
        TemplateEngine engine = TemplateEngineFactory.create(properties.toOptions());
        log.info("JSlice template engine configured: {}", engine.name());
        return engine;
    }

    /**
     * 监控组件配置：Micrometer 在类路径中且存在 MeterRegistry Bean 时启用
     */
    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(SliceMetrics.class)
        public SliceMetrics sliceMetrics(MeterRegistry registry) {
            return new MicrometerSliceMetrics(registry);
        }
    }

    // 保底配置：如果没有 Metrics 环境，注入空实现
    @Bean
    @ConditionalOnMissingBean(SliceMetrics.class)
    public SliceMetrics defaultSliceMetrics() {
        return new NoOpSliceMetrics();
    }

    @Bean
    @ConditionalOnMissingBean(SqlTemplater.class)
    public SqlTemplater sqlTemplater(TemplateEngine engine, JSliceProperties properties, SliceMetrics metrics) {
        return new SqlTemplater(engine, properties.toOptions(), metrics);
    }

    @Bean
    @ConditionalOnMissingBean(TemplaterCache.class)
    public TemplaterCache templaterCache(JSliceProperties properties) {
        return new TemplaterCache(properties.getCacheMaximumSize(), properties.getCacheExpireMinutes());
    }
}
