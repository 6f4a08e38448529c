package com.chih.JSlice.core.engine;

import com.chih.JSlice.core.impl.MustacheTemplateEngine;
import com.chih.JSlice.core.impl.RawTemplateEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Templater 缓存测试")
class TemplaterCacheTest {

    @Test
    @DisplayName("同一 key 只创建一次")
    void testGetOrCreate() {
        TemplaterCache cache = new TemplaterCache();
        AtomicInteger created = new AtomicInteger();

        SqlTemplater first = cache.getOrCreate("project-a", () -> {
            created.incrementAndGet();
            return new SqlTemplater(new MustacheTemplateEngine());
        });
        SqlTemplater second = cache.getOrCreate("project-a", () -> {
            created.incrementAndGet();
            return new SqlTemplater(new RawTemplateEngine());
        });

        assertThat(second).isSameAs(first);
        assertThat(created.get()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("清空后重新创建")
    void testClear() {
        TemplaterCache cache = new TemplaterCache(10, 5);
        SqlTemplater first = cache.getOrCreate("k", () -> new SqlTemplater(new RawTemplateEngine()));

        cache.clear();

        assertThat(cache.size()).isZero();
        assertThat(cache.getOrCreate("k", () -> new SqlTemplater(new RawTemplateEngine()))).isNotSameAs(first);
    }

    @Test
    @DisplayName("在 key 锁内使用 templater")
    void testWithTemplater() {
        TemplaterCache cache = new TemplaterCache();

        String rendered = cache.withTemplater("k", () -> new SqlTemplater(new MustacheTemplateEngine()),
                templater -> templater.process("SELECT {{x}}", "q.sql", Map.of("x", 1)).renderedText());

        assertThat(rendered).isEqualTo("SELECT 1");
    }

    @Test
    @DisplayName("持有 key 锁期间清空缓存，同一 key 的调用仍然串行")
    void testClearWhileKeyHeld() throws Exception {
        TemplaterCache cache = new TemplaterCache(10, 5);
        CountDownLatch firstEntered = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            Future<String> first = executor.submit(() -> cache.withTemplater("k",
                    () -> new SqlTemplater(new RawTemplateEngine()), templater -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        firstEntered.countDown();
                        try {
                            releaseFirst.await(5, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        inside.decrementAndGet();
                        return "first";
                    }));
            assertThat(firstEntered.await(5, TimeUnit.SECONDS)).isTrue();

            cache.clear();

            Future<String> second = executor.submit(() -> cache.withTemplater("k",
                    () -> new SqlTemplater(new RawTemplateEngine()), templater -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        inside.decrementAndGet();
                        return "second";
                    }));
            Thread.sleep(200);
            assertThat(second.isDone()).as("second call must wait for the key lock").isFalse();

            releaseFirst.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo("first");
            assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo("second");
            assertThat(maxInside.get()).isEqualTo(1);
        } finally {
            releaseFirst.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("创建逻辑返回 null")
    void testNullFactoryResult() {
        TemplaterCache cache = new TemplaterCache();

        assertThatThrownBy(() -> cache.getOrCreate("k", () -> null))
                .isInstanceOf(NullPointerException.class);
        assertThat(cache.size()).isZero();
    }
}
