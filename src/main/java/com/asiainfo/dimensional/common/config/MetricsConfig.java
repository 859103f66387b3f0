package com.asiainfo.dimensional.common.config;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 指标服务配置
 * 统一管理 schema 初始化、检索、查询缓存与上传限制
 *
 * @author QvQ
 * @date 2026/10/12
 */
@ApplicationScoped
public class MetricsConfig {

    private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

    @ConfigProperty(name = "metrics.schema.auto-create", defaultValue = "true")
    boolean schemaAutoCreate;

    @ConfigProperty(name = "metrics.search.default-similarity", defaultValue = "0.25")
    double defaultSimilarity;

    // 查询结果缓存
    @ConfigProperty(name = "metrics.query.cache.enabled", defaultValue = "true")
    boolean queryCacheEnabled;

    @ConfigProperty(name = "metrics.query.cache.ttl-seconds", defaultValue = "60")
    int queryCacheTtlSeconds;

    @ConfigProperty(name = "metrics.query.cache.max-size", defaultValue = "1000")
    int queryCacheMaxSize;

    @ConfigProperty(name = "metrics.upload.max-bytes", defaultValue = "52428800")
    long uploadMaxBytes;

    @PostConstruct
    void init() {
        log.info("=== Metrics Configuration ===");
        log.info("Schema auto-create: {}", schemaAutoCreate ? "ENABLED" : "DISABLED");
        log.info("Search similarity:  {}", defaultSimilarity);
        log.info("Query cache:        {} (TTL: {}s, MaxSize: {})",
                queryCacheEnabled ? "ENABLED" : "DISABLED", queryCacheTtlSeconds, queryCacheMaxSize);
        log.info("Upload max bytes:   {}", uploadMaxBytes);
        log.info("=============================");
    }

    public boolean isSchemaAutoCreate() {
        return schemaAutoCreate;
    }

    public double getDefaultSimilarity() {
        return defaultSimilarity;
    }

    public boolean isQueryCacheEnabled() {
        return queryCacheEnabled;
    }

    public int getQueryCacheTtlSeconds() {
        return queryCacheTtlSeconds;
    }

    public int getQueryCacheMaxSize() {
        return queryCacheMaxSize;
    }

    public long getUploadMaxBytes() {
        return uploadMaxBytes;
    }
}
