package com.asiainfo.dimensional.infrastructure.persistence;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * 在同一连接（事务）内执行的一段 JDBC 操作
 */
@FunctionalInterface
public interface SqlWork<T> {

    T execute(Connection conn) throws SQLException;
}
