package com.spiderjobs.crawl.model;

public enum ErrorClass {
    SUCCESS,
    TRANSIENT,
    BLOCKING,
    PERMANENT,
    CANCELLED
}
