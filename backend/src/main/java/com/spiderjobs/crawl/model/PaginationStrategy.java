package com.spiderjobs.crawl.model;

import java.util.Locale;

public enum PaginationStrategy {
    NONE,
    LINKS,
    PAGE_PARAM;

    public static PaginationStrategy fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return LINKS;
        }
        return PaginationStrategy.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
