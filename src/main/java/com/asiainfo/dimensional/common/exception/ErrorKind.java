package com.asiainfo.dimensional.common.exception;

/**
 * 错误分类，对外暴露为稳定的机器可读字段
 */
public enum ErrorKind {
    NOT_FOUND,
    INVALID,
    CONFLICT,
    STORE_UNAVAILABLE
}
