package com.asiainfo.dimensional.domain.grain;

import com.asiainfo.dimensional.domain.model.Grain;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 源粒度选择
 * <p>
 * 在已存储的粒度中，优先选择不粗于请求粒度的最粗一个；
 * 若所有已存储粒度都比请求粗，则退回最细的那个（结果会比请求粗，调用方静默接受）。
 * 没有任何已存储粒度时原样返回请求粒度。
 */
public final class GrainResolver {

    private GrainResolver() {
    }

    public static Grain resolve(Collection<Grain> stored, Grain requested) {
        if (stored == null || stored.isEmpty()) {
            return requested;
        }
        return stored.stream()
                .filter(g -> g.rank() <= requested.rank())
                .max(Comparator.comparingInt(Grain::rank))
                .orElseGet(() -> stored.stream()
                        .min(Comparator.comparingInt(Grain::rank))
                        .orElse(requested));
    }

    /**
     * 每个指标只解析一次
     */
    public static Map<Long, Grain> resolveAll(Map<Long, Set<Grain>> storedByMetric, Grain requested) {
        Map<Long, Grain> resolved = new LinkedHashMap<>();
        storedByMetric.forEach((metricId, grains) -> resolved.put(metricId, resolve(grains, requested)));
        return resolved;
    }
}
