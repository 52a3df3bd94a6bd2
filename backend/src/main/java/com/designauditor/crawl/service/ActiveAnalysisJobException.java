package com.designauditor.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveAnalysisJobException extends RuntimeException {
    public ActiveAnalysisJobException(String message) {
        super(message);
    }
}
