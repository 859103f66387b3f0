package com.asiainfo.dimensional.infrastructure.cache;

/**
 * 查询缓存键：查询类型 + 数据版本 + 请求内容
 * 数据版本在每次成功入库后递增，旧版本的键自然失效
 */
public record QueryCacheKey(String mode, long dataVersion, Object request) {

    public String toKey() {
        return mode + ":v" + dataVersion + ":" + request;
    }
}
