package com.asiainfo.dimensional.common.exception;

/**
 * 存储层失败，所在事务一定已回滚
 */
public class StoreUnavailableException extends MetricsException {

    public StoreUnavailableException(String detail, Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, detail, cause);
    }
}
