package com.threadsmith.web;

import org.springframework.http.HttpStatus;

public class PersonalityNotFoundException extends ApiException {

    public PersonalityNotFoundException(String name) {
        super(HttpStatus.NOT_FOUND, "personality_not_found", "Personality '" + name + "' not found");
    }
}
