package com.chih.JSlice.core.engine;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link SqlTemplater} 缓存
 * <p>
 * 同一配置（key）只创建一个 templater。创建过程在写锁内完成，避免并发下重复创建；
 * 读取走 Caffeine 的无锁路径。
 * {@link #withTemplater} 额外提供按 key 串行化的使用方式，适用于调用方需要独占某个 templater 的场景。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/15
 */
public class TemplaterCache {

    private static final Logger log = LoggerFactory.getLogger(TemplaterCache.class);

    public static final long DEFAULT_MAXIMUM_SIZE = 1000;
    public static final long DEFAULT_EXPIRE_MINUTES = 30;

    private final Cache<String, SqlTemplater> cache;

    // 按 key 串行化使用；弱引用值，只有不再被任何线程持有或等待的锁才会被回收
    private final Cache<String, ReentrantLock> keyLocks;

    private final ReentrantLock writeLock = new ReentrantLock();

    public TemplaterCache() {
        this(DEFAULT_MAXIMUM_SIZE, DEFAULT_EXPIRE_MINUTES);
    }

    public TemplaterCache(long maximumSize, long expireMinutes) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterAccess(expireMinutes, TimeUnit.MINUTES)
                .removalListener((key, templater, cause) ->
                        log.debug("Templater removed for key: {}, reason: {}", key, cause))
                .build();
        this.keyLocks = Caffeine.newBuilder()
                .weakValues()
                .build();
    }

    /**
     * 获取或创建 templater
     *
     * @param key 配置标识
     * @param factory 缓存未命中时的创建逻辑，同一 key 最多被调用一次（在过期前）
     */
    public SqlTemplater getOrCreate(String key, Supplier<SqlTemplater> factory) {
        Objects.requireNonNull(key, "key");
        SqlTemplater templater = cache.getIfPresent(key);
        if (templater != null) {
            return templater;
        }
        writeLock.lock();
        try {
            // Double-Check
            templater = cache.getIfPresent(key);
            if (templater == null) {
                templater = Objects.requireNonNull(factory.get(), "factory returned null");
                cache.put(key, templater);
                log.debug("Templater created for key: {}", key);
            }
            return templater;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 在 key 对应的锁内使用 templater，同一 key 的调用依次执行
     * <p>
     * {@link #clear()} 只清空 templater，不影响正在持有或等待的 key 锁。
     * </p>
     */
    public <T> T withTemplater(String key, Supplier<SqlTemplater> factory, Function<SqlTemplater, T> action) {
        ReentrantLock lock = keyLocks.get(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.apply(getOrCreate(key, factory));
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        writeLock.lock();
        try {
            cache.invalidateAll();
            log.info("Templater cache cleared");
        } finally {
            writeLock.unlock();
        }
    }

    public int size() {
        return cache.asMap().size();
    }
}
