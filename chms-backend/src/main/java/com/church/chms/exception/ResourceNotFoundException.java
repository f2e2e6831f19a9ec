package com.church.chms.exception;

import org.springframework.http.HttpStatus;

/**
 * 404 资源不存在
 */
public class ResourceNotFoundException extends ChmsException {

    public ResourceNotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
