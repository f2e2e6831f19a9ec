package com.church.chms.exception;

import org.springframework.http.HttpStatus;

/**
 * 400 参数校验或业务规则不满足
 */
public class BadRequestException extends ChmsException {

    public BadRequestException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
