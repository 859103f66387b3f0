package com.asiainfo.dimensional.application.query;

import com.asiainfo.dimensional.common.exception.InvalidRequestException;
import com.asiainfo.dimensional.domain.model.DimensionFilter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 解析 GET 接口的维度过滤参数
 * 格式：dimension_id:value_id[|value_id...]，同一维度出现多次时取值合并
 */
public final class DimensionPairParser {

    private DimensionPairParser() {
    }

    public static List<DimensionFilter> parse(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        Map<Long, List<Long>> valueIds = new LinkedHashMap<>();
        for (String item : raw) {
            if (item == null || item.isBlank()) {
                continue;
            }
            String[] parts = item.split(":", 2);
            if (parts.length != 2 || parts[1].isBlank()) {
                throw invalid(item);
            }
            long dimensionId = parseId(parts[0], item);
            List<Long> target = valueIds.computeIfAbsent(dimensionId, k -> new ArrayList<>());
            for (String value : parts[1].split("\\|")) {
                if (!value.isBlank()) {
                    target.add(parseId(value, item));
                }
            }
        }
        List<DimensionFilter> filters = new ArrayList<>();
        valueIds.forEach((dimensionId, ids) -> filters.add(DimensionFilter.byId(dimensionId, ids)));
        return filters;
    }

    private static long parseId(String text, String item) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw invalid(item);
        }
    }

    private static InvalidRequestException invalid(String item) {
        return new InvalidRequestException("invalid dimensions filter: " + item
                + " (expected dimension_id:value_id[|value_id])");
    }
}
