package com.stockalert.data.http;

import java.io.IOException;

public class HttpStatusException extends IOException {
    private final int statusCode;

    public HttpStatusException(int statusCode, String url) {
        super("HTTP " + statusCode + " for " + withoutQuery(url));
        this.statusCode = statusCode;
    }

    /**
     * Query strings may carry API keys.
     */
    static String withoutQuery(String url) {
        if (url == null) {
            return "";
        }
        int q = url.indexOf('?');
        return q < 0 ? url : url.substring(0, q);
    }

    public int statusCode() {
        return statusCode;
    }
}
