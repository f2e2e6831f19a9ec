package com.church.chms.exception;

import org.springframework.http.HttpStatus;

/**
 * 403 权限不足
 */
public class ForbiddenException extends ChmsException {

    public ForbiddenException(String message) {
        super(HttpStatus.FORBIDDEN, message);
    }
}
