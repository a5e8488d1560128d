package com.pyformatter.server;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Status code, headers and body answered to one format request.
 */
public final class FormatResponse {
    public static final int OK = 200;
    public static final int NO_CHANGES = 204;
    public static final int BAD_REQUEST = 400;
    public static final int INTERNAL_ERROR = 500;

    private final int status;
    private final String body;
    private final Map<String, String> headers;

    private FormatResponse(int status, String body, Map<String, String> headers) {
        this.status = status;
        this.body = body;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    static FormatResponse of(int status, String body) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(FormatRequestHandler.PROTOCOL_VERSION_HEADER, FormatRequestHandler.PROTOCOL_VERSION);
        if (!body.isEmpty()) {
            headers.put("Content-Type", "text/plain; charset=utf-8");
        }
        return new FormatResponse(status, body, headers);
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    @Override
    public String toString() {
        return "FormatResponse{status=" + status + ", body=" + body.length() + " chars}";
    }
}
