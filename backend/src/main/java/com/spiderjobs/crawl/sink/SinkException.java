package com.spiderjobs.crawl.sink;

/**
 * A listing could not be written. The router may retry the same listing.
 */
public class SinkException extends Exception {
    public SinkException(String message) {
        super(message);
    }

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
