package com.spiderjobs.crawl.parser;

/**
 * A fetched page could not be interpreted. Non-fatal to the crawl.
 */
public class ParseException extends Exception {
    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
