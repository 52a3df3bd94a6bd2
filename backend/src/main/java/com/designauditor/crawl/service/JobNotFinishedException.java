package com.designauditor.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class JobNotFinishedException extends RuntimeException {
    public JobNotFinishedException(String message) {
        super(message);
    }
}
