package com.threadsmith.web;

import org.springframework.http.HttpStatus;

public class DuplicatePersonalityNameException extends ApiException {

    public DuplicatePersonalityNameException(String name) {
        super(HttpStatus.CONFLICT, "duplicate_name", "Personality '" + name + "' already exists");
    }
}
