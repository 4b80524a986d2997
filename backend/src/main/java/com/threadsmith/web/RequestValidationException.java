package com.threadsmith.web;

import org.springframework.http.HttpStatus;

public class RequestValidationException extends ApiException {

    public RequestValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, "validation_error", message);
    }
}
