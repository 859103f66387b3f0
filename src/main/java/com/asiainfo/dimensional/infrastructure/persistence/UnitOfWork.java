package com.asiainfo.dimensional.infrastructure.persistence;

import com.asiainfo.dimensional.common.exception.StoreUnavailableException;
import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * 请求级事务边界
 * <p>
 * read：自动提交连接上的只读操作；
 * write：手动事务，全部成功才提交，任何异常回滚后原样（或转换后）抛出。
 *
 * @author QvQ
 * @date 2026/10/12
 */
@ApplicationScoped
public class UnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(UnitOfWork.class);

    @Inject
    AgroalDataSource dataSource;

    public <T> T read(String operation, SqlWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            return work.execute(conn);
        } catch (SQLException e) {
            throw StoreErrors.translate(operation, e);
        }
    }

    public <T> T write(String operation, SqlWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException e) {
                rollback(conn, operation);
                throw StoreErrors.translate(operation, e);
            } catch (RuntimeException e) {
                rollback(conn, operation);
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException(operation + " could not obtain a connection: " + e.getMessage(), e);
        }
    }

    /**
     * 存储连通性检查
     */
    public boolean isReachable() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("[Store] health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void rollback(Connection conn, String operation) {
        try {
            conn.rollback();
            log.warn("[Store] {} rolled back", operation);
        } catch (SQLException e) {
            log.error("[Store] rollback of {} failed", operation, e);
        }
    }
}
