package com.threadsmith.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base for failures that reject a whole request with a stable error code.
 */
@Getter
public class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public ApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }
}
