package com.asiainfo.dimensional.infrastructure.cache;

import com.asiainfo.dimensional.common.config.MetricsConfig;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * 查询结果 Caffeine 本地缓存
 * 失效方式：入库成功后 bumpVersion()，新请求使用新版本键
 */
@ApplicationScoped
public class QueryResultCache {

    private static final Logger log = LoggerFactory.getLogger(QueryResultCache.class);

    @Inject
    MetricsConfig config;

    private final AtomicLong dataVersion = new AtomicLong();

    private Cache<String, Object> cache;

    @PostConstruct
    void init() {
        cache = Caffeine.newBuilder()
                .expireAfterWrite(config.getQueryCacheTtlSeconds(), TimeUnit.SECONDS)
                .maximumSize(config.getQueryCacheMaxSize())
                .recordStats()
                .build();

        log.info("[Query Cache] Initialized with TTL={}s, MaxSize={}, enabled={}",
                config.getQueryCacheTtlSeconds(), config.getQueryCacheMaxSize(), config.isQueryCacheEnabled());
    }

    public QueryCacheKey keyFor(String mode, Object request) {
        return new QueryCacheKey(mode, dataVersion.get(), request);
    }

    /**
     * 命中则返回缓存值，否则计算并写入
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrCompute(QueryCacheKey key, Supplier<T> loader) {
        if (!config.isQueryCacheEnabled()) {
            return loader.get();
        }
        Object value = cache.getIfPresent(key.toKey());
        if (value != null) {
            log.debug("[Query Cache] Hit: {}", key.mode());
            return (T) value;
        }
        T computed = loader.get();
        if (computed != null && key.dataVersion() == dataVersion.get()) {
            cache.put(key.toKey(), computed);
        }
        return computed;
    }

    /**
     * 数据变更后调用，使所有已缓存结果失效
     */
    public long bumpVersion() {
        long version = dataVersion.incrementAndGet();
        cache.invalidateAll();
        log.info("[Query Cache] data version bumped to {}", version);
        return version;
    }

    public long currentVersion() {
        return dataVersion.get();
    }

    public String getStats() {
        var stats = cache.stats();
        return String.format("hits=%d, misses=%d, hitRate=%.2f%%, size=%d",
                stats.hitCount(), stats.missCount(), stats.hitRate() * 100, cache.estimatedSize());
    }
}
