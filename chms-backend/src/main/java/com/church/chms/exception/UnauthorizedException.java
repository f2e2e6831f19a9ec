package com.church.chms.exception;

import org.springframework.http.HttpStatus;

/**
 * 401 未提供调用者身份
 */
public class UnauthorizedException extends ChmsException {

    public UnauthorizedException(String message) {
        super(HttpStatus.UNAUTHORIZED, message);
    }
}
