package com.asiainfo.dimensional.common.exception;

/**
 * 输入不合法：粒度不支持、过滤条件格式错误、CSV 内容无法解析等
 */
public class InvalidRequestException extends MetricsException {

    public InvalidRequestException(String detail) {
        super(ErrorKind.INVALID, detail);
    }
}
