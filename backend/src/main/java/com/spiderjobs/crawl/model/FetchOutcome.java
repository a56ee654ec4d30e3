package com.spiderjobs.crawl.model;

public enum FetchOutcome {
    SUCCESS,
    NOT_FOUND,
    CLIENT_ERROR,
    SERVER_ERROR,
    TIMEOUT,
    NETWORK_ERROR,
    BLOCKED,
    INVALID,
    CANCELLED;

    public boolean countsAsSiteError() {
        return this == SERVER_ERROR || this == TIMEOUT || this == NETWORK_ERROR || this == BLOCKED;
    }
}
