package com.tubedigest.feed.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveCycleRunException extends RuntimeException {
    public ActiveCycleRunException(String message) {
        super(message);
    }
}
