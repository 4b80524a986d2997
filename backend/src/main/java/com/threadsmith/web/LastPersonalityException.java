package com.threadsmith.web;

import org.springframework.http.HttpStatus;

public class LastPersonalityException extends ApiException {

    public LastPersonalityException(String name) {
        super(HttpStatus.CONFLICT, "last_personality",
                "Cannot delete '" + name + "': a user must keep at least one personality");
    }
}
