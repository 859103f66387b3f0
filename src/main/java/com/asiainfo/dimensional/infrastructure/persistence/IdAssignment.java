package com.asiainfo.dimensional.infrastructure.persistence;

import java.util.Map;

/**
 * 批量“查找或插入”的结果：自然键 -> 代理键，以及新建 / 命中计数
 */
public record IdAssignment<K>(Map<K, Long> ids, int created, int matched) {

    public IdAssignment {
        ids = Map.copyOf(ids);
    }

    public long idOf(K key) {
        Long id = ids.get(key);
        if (id == null) {
            throw new IllegalStateException("no id assigned for " + key);
        }
        return id;
    }
}
