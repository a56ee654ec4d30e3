package com.spiderjobs.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class UnknownSiteException extends RuntimeException {
    public UnknownSiteException(String siteId) {
        super("Unknown site: " + siteId);
    }
}
