package com.asiainfo.dimensional.domain.grain;

import com.asiainfo.dimensional.domain.model.Grain;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class GrainResolverTest {

    @Test
    void picksCoarsestStoredGrainNotCoarserThanRequested() {
        assertEquals(Grain.DAY, GrainResolver.resolve(List.of(Grain.HOUR, Grain.DAY), Grain.WEEK));
        assertEquals(Grain.WEEK, GrainResolver.resolve(List.of(Grain.DAY, Grain.WEEK), Grain.MONTH));
        assertEquals(Grain.DAY, GrainResolver.resolve(List.of(Grain.DAY), Grain.DAY));
    }

    /**
     * 全部已存储粒度都比请求粗时，退回最细的那个
     */
    @Test
    void fallsBackToFinestWhenEverythingIsCoarser() {
        assertEquals(Grain.DAY, GrainResolver.resolve(List.of(Grain.MONTH, Grain.DAY), Grain.HOUR));
        assertEquals(Grain.WEEK, GrainResolver.resolve(List.of(Grain.QUARTER, Grain.WEEK), Grain.MIN_30));
    }

    @Test
    void returnsRequestedWhenNothingStored() {
        assertEquals(Grain.MONTH, GrainResolver.resolve(List.of(), Grain.MONTH));
        assertEquals(Grain.HOUR, GrainResolver.resolve(null, Grain.HOUR));
    }

    @Test
    void resolvesEachMetricIndependently() {
        Map<Long, Set<Grain>> stored = new LinkedHashMap<>();
        stored.put(1L, Set.of(Grain.DAY));
        stored.put(2L, Set.of(Grain.HOUR, Grain.WEEK));
        Map<Long, Grain> resolved = GrainResolver.resolveAll(stored, Grain.WEEK);
        assertEquals(Grain.DAY, resolved.get(1L));
        assertEquals(Grain.WEEK, resolved.get(2L));
    }
}
