package com.asiainfo.dimensional.common.exception;

/**
 * 唯一约束冲突
 */
public class ConflictException extends MetricsException {

    public ConflictException(String detail, Throwable cause) {
        super(ErrorKind.CONFLICT, detail, cause);
    }
}
