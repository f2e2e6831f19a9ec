package com.church.chms.exception;

import org.springframework.http.HttpStatus;

/**
 * 业务异常基类：携带对应的 HTTP 状态码，由 GlobalExceptionHandler 统一转换为 CommonResponse。
 */
public class ChmsException extends RuntimeException {

    private final HttpStatus status;

    public ChmsException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
