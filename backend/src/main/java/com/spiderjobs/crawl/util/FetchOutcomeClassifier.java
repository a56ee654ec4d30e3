package com.spiderjobs.crawl.util;

import com.spiderjobs.crawl.model.ErrorClass;
import com.spiderjobs.crawl.model.FetchOutcome;
import com.spiderjobs.crawl.model.HttpFetchResult;

import java.util.List;
import java.util.Locale;

public final class FetchOutcomeClassifier {
    public static final String TIMEOUT = "timeout";
    public static final String IO_ERROR = "io_error";
    public static final String INVALID_URL = "invalid_url";
    public static final String INTERRUPTED = "interrupted";
    public static final String HTTP_ERROR = "http_error";
    public static final String FETCH_ERROR = "fetch_error";

    private FetchOutcomeClassifier() {
    }

    public static FetchOutcome classify(HttpFetchResult result, List<String> captchaPatterns) {
        if (result == null) {
            return FetchOutcome.NETWORK_ERROR;
        }
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return fromErrorCode(errorCode);
        }
        int status = result.statusCode();
        if (status >= 200 && status < 300) {
            return looksLikeCaptcha(result.body(), captchaPatterns) ? FetchOutcome.BLOCKED : FetchOutcome.SUCCESS;
        }
        return fromHttpStatus(status);
    }

    public static FetchOutcome fromHttpStatus(int status) {
        if (status == 403 || status == 429) {
            return FetchOutcome.BLOCKED;
        }
        if (status == 404 || status == 410) {
            return FetchOutcome.NOT_FOUND;
        }
        if (status == 408) {
            return FetchOutcome.TIMEOUT;
        }
        if (status >= 500 && status < 600) {
            return FetchOutcome.SERVER_ERROR;
        }
        if (status >= 300 && status < 500) {
            return FetchOutcome.CLIENT_ERROR;
        }
        return FetchOutcome.NETWORK_ERROR;
    }

    public static FetchOutcome fromErrorCode(String errorCode) {
        String code = errorCode.toLowerCase(Locale.ROOT);
        if (code.contains(TIMEOUT)) {
            return FetchOutcome.TIMEOUT;
        }
        if (code.equals(INVALID_URL)) {
            return FetchOutcome.INVALID;
        }
        if (code.equals(INTERRUPTED)) {
            return FetchOutcome.CANCELLED;
        }
        return FetchOutcome.NETWORK_ERROR;
    }

    public static ErrorClass errorClass(FetchOutcome outcome) {
        return switch (outcome) {
            case SUCCESS -> ErrorClass.SUCCESS;
            case BLOCKED -> ErrorClass.BLOCKING;
            case SERVER_ERROR, TIMEOUT, NETWORK_ERROR -> ErrorClass.TRANSIENT;
            case NOT_FOUND, CLIENT_ERROR, INVALID -> ErrorClass.PERMANENT;
            case CANCELLED -> ErrorClass.CANCELLED;
        };
    }

    public static boolean looksLikeCaptcha(String body, List<String> patterns) {
        if (body == null || body.isBlank() || patterns == null || patterns.isEmpty()) {
            return false;
        }
        String lower = body.toLowerCase(Locale.ROOT);
        for (String pattern : patterns) {
            if (pattern != null && !pattern.isBlank() && lower.contains(pattern.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
