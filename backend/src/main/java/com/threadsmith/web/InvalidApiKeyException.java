package com.threadsmith.web;

import org.springframework.http.HttpStatus;

public class InvalidApiKeyException extends ApiException {

    public InvalidApiKeyException() {
        super(HttpStatus.FORBIDDEN, "auth_error", "Invalid API key");
    }
}
