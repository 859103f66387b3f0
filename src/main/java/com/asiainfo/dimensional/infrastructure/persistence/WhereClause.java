package com.asiainfo.dimensional.infrastructure.persistence;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 目录过滤条件拼装：列名只来自代码常量，取值全部参数化
 */
public class WhereClause {

    private final List<String> conditions = new ArrayList<>();
    private final List<Object> params = new ArrayList<>();

    public WhereClause in(String column, Collection<?> values) {
        if (values != null && !values.isEmpty()) {
            conditions.add(column + " IN (" + SqlSupport.placeholders(values.size()) + ")");
            params.addAll(values);
        }
        return this;
    }

    public WhereClause eq(String column, Object value) {
        if (value != null) {
            conditions.add(column + " = ?");
            params.add(value);
        }
        return this;
    }

    public WhereClause gte(String column, Object value) {
        if (value != null) {
            conditions.add(column + " >= ?");
            params.add(value);
        }
        return this;
    }

    public WhereClause lt(String column, Object value) {
        if (value != null) {
            conditions.add(column + " < ?");
            params.add(value);
        }
        return this;
    }

    public String toSql() {
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    public List<Object> params() {
        return params;
    }
}
