package com.asiainfo.dimensional.common.exception;

/**
 * 指标服务异常基类
 * 所有对调用方可见的失败都携带 {@link ErrorKind} 和可读的描述
 */
public class MetricsException extends RuntimeException {

    private final ErrorKind kind;

    public MetricsException(ErrorKind kind, String detail) {
        super(detail);
        this.kind = kind;
    }

    public MetricsException(ErrorKind kind, String detail, Throwable cause) {
        super(detail, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getDetail() {
        return getMessage();
    }
}
