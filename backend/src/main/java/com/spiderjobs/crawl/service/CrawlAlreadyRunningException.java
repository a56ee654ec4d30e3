package com.spiderjobs.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class CrawlAlreadyRunningException extends RuntimeException {
    public CrawlAlreadyRunningException(String message) {
        super(message);
    }
}
