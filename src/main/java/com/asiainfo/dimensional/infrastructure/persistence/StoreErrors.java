package com.asiainfo.dimensional.infrastructure.persistence;

import com.asiainfo.dimensional.common.exception.ConflictException;
import com.asiainfo.dimensional.common.exception.MetricsException;
import com.asiainfo.dimensional.common.exception.StoreUnavailableException;

import java.sql.SQLException;

/**
 * SQLException 到业务异常的转换
 * <p>
 * SQLState 23xxx（完整性约束冲突）视为 CONFLICT，其余一律视为存储不可用。
 */
public final class StoreErrors {

    private static final String INTEGRITY_VIOLATION_CLASS = "23";

    private StoreErrors() {
    }

    public static MetricsException translate(String operation, SQLException e) {
        String state = e.getSQLState();
        if (state != null && state.startsWith(INTEGRITY_VIOLATION_CLASS)) {
            return new ConflictException(operation + " violated a uniqueness or integrity constraint: "
                    + e.getMessage(), e);
        }
        return new StoreUnavailableException(operation + " failed: " + e.getMessage(), e);
    }
}
