package com.chih.JSlice.spring;

import com.chih.JSlice.core.engine.SqlTemplater;
import com.chih.JSlice.core.engine.TemplaterCache;
import com.chih.JSlice.core.exception.TemplaterConfigException;
import com.chih.JSlice.core.impl.MustacheTemplateEngine;
import com.chih.JSlice.core.impl.NoOpSliceMetrics;
import com.chih.JSlice.core.impl.PlaceholderTemplateEngine;
import com.chih.JSlice.core.impl.RawTemplateEngine;
import com.chih.JSlice.core.spi.SliceMetrics;
import com.chih.JSlice.core.spi.TemplateEngine;
import com.chih.JSlice.spring.metrics.MicrometerSliceMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * JSliceAutoConfiguration 单元测试
 *
 * 测试 Spring Boot 自动配置功能，包括：
 * - 默认 Bean 的创建
 * - j-slice.* 属性绑定
 * - Micrometer 监控的条件装配
 * - 用户自定义 Bean 覆盖
 */
@DisplayName("JSliceAutoConfiguration 测试")
class JSliceAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JSliceAutoConfiguration.class));

    @Test
    @DisplayName("JSliceProperties 默认配置应该正确")
    void testPropertiesDefaults() {
        JSliceProperties properties = new JSliceProperties();

        assertThat(properties.getTemplater()).isEqualTo("mustache");
        assertThat(properties.isUnwrapWrappedQueries()).isTrue();
        assertThat(properties.isIgnoreTemplating()).isFalse();
        assertThat(properties.getContext()).isEmpty();
        assertThat(properties.getCacheMaximumSize()).isEqualTo(TemplaterCache.DEFAULT_MAXIMUM_SIZE);
        assertThat(properties.getCacheExpireMinutes()).isEqualTo(TemplaterCache.DEFAULT_EXPIRE_MINUTES);

        /* 验证注解属性 */
        assertThat(JSliceProperties.class.getAnnotation(ConfigurationProperties.class).prefix()).isEqualTo("j-slice");
    }

    @Test
    @DisplayName("默认配置下创建全部核心 Bean")
    void testDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(TemplateEngine.class);
            assertThat(context.getBean(TemplateEngine.class)).isInstanceOf(MustacheTemplateEngine.class);
            assertThat(context).hasSingleBean(SqlTemplater.class);
            assertThat(context).hasSingleBean(TemplaterCache.class);
            assertThat(context.getBean(SliceMetrics.class)).isInstanceOf(NoOpSliceMetrics.class);
        });
    }

    @Test
    @DisplayName("属性绑定：placeholder 引擎与渲染上下文")
    void testPlaceholderProperties() {
        contextRunner
                .withPropertyValues(
                        "j-slice.templater=placeholder",
                        "j-slice.param-style=colon",
                        "j-slice.unwrap-wrapped-queries=false",
                        "j-slice.context.tbl=orders")
                .run(context -> {
                    assertThat(context.getBean(TemplateEngine.class)).isInstanceOf(PlaceholderTemplateEngine.class);

                    SqlTemplater templater = context.getBean(SqlTemplater.class);
                    assertThat(templater.getOptions().isUnwrapWrappedQueries()).isFalse();
                    assertThat(templater.process("SELECT * FROM :tbl", "query.sql").renderedText())
                            .isEqualTo("SELECT * FROM orders");
                });
    }

    @Test
    @DisplayName("未知引擎导致启动失败")
    void testInvalidTemplater() {
        contextRunner
                .withPropertyValues("j-slice.templater=velocity")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(TemplaterConfigException.class);
                });
    }

    @Test
    @DisplayName("存在 MeterRegistry 时使用 Micrometer 监控")
    void testMicrometerMetrics() {
        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> {
                    assertThat(context).hasSingleBean(SliceMetrics.class);
                    assertThat(context.getBean(SliceMetrics.class)).isInstanceOf(MicrometerSliceMetrics.class);

                    context.getBean(SqlTemplater.class).process("SELECT {{x}}", "metrics.sql", Map.of("x", 1));
                    MeterRegistry registry = context.getBean(MeterRegistry.class);
                    assertThat(registry.get("jslice.slice.count").tag("file", "metrics.sql").counter().count())
                            .isEqualTo(1.0);
                });
    }

    @Test
    @DisplayName("用户自定义 Bean 优先")
    void testUserBeansOverride() {
        contextRunner
                .withUserConfiguration(CustomEngineConfiguration.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(TemplateEngine.class);
                    assertThat(context.getBean(TemplateEngine.class)).isInstanceOf(RawTemplateEngine.class);
                    assertThat(context.getBean(SqlTemplater.class).getEngine()).isInstanceOf(RawTemplateEngine.class);
                });
    }

    @Test
    @DisplayName("用户提供的监控 Bean 优先，即使存在 MeterRegistry")
    void testUserMetricsOverride() {
        SliceMetrics metrics = mock(SliceMetrics.class);

        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .withBean(SliceMetrics.class, () -> metrics)
                .run(context -> {
                    assertThat(context).hasSingleBean(SliceMetrics.class);
                    assertThat(context.getBean(SliceMetrics.class)).isSameAs(metrics);

                    context.getBean(SqlTemplater.class).process("SELECT {{x}}", "user.sql", Map.of("x", 1));
                    verify(metrics).recordSlice(eq("user.sql"), anyLong(), eq(true));
                });
    }

    @Test
    @DisplayName("缓存容量来自配置")
    void testCacheProperties() {
        contextRunner
                .withPropertyValues("j-slice.cache-maximum-size=5", "j-slice.cache-expire-minutes=1")
                .run(context -> {
                    JSliceProperties properties = context.getBean(JSliceProperties.class);
                    assertThat(properties.getCacheMaximumSize()).isEqualTo(5);
                    assertThat(properties.getCacheExpireMinutes()).isEqualTo(1);
                    assertThat(context.getBean(TemplaterCache.class).size()).isZero();
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomEngineConfiguration {

        @Bean
        TemplateEngine customEngine() {
            return new RawTemplateEngine();
        }
    }
}
