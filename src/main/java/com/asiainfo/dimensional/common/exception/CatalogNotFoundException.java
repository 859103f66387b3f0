package com.asiainfo.dimensional.common.exception;

import java.util.List;

/**
 * 指标/维度 key 不存在
 * 一次性列出全部缺失的 key，而不是只报第一个
 */
public class CatalogNotFoundException extends MetricsException {

    private final String keyType;
    private final List<String> missingKeys;

    public CatalogNotFoundException(String keyType, List<String> missingKeys) {
        super(ErrorKind.NOT_FOUND, keyType + " not found: " + String.join(", ", missingKeys));
        this.keyType = keyType;
        this.missingKeys = List.copyOf(missingKeys);
    }

    public static CatalogNotFoundException metricKeys(List<String> missing) {
        return new CatalogNotFoundException("metric_key", missing);
    }

    public static CatalogNotFoundException dimensionKeys(List<String> missing) {
        return new CatalogNotFoundException("dimension_key", missing);
    }

    public String getKeyType() {
        return keyType;
    }

    public List<String> getMissingKeys() {
        return missingKeys;
    }
}
