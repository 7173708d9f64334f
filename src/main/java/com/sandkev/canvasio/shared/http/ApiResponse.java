package com.sandkev.canvasio.shared.http;

import org.springframework.http.HttpHeaders;

/** Raw outcome of one HTTP exchange, before the scheduler classifies it. */
public record ApiResponse(int status, HttpHeaders headers, String body) {

    public ApiResponse {
        headers = headers != null ? headers : HttpHeaders.EMPTY;
        body = body != null ? body : "";
    }

    /** Server-reported remaining quota, or {@code null} when the header is absent. */
    public Double rateLimitRemaining() {
        return HttpRetrySupport.parseRemaining(headers.getFirst(HttpRetrySupport.RATE_LIMIT_REMAINING));
    }

    public String linkHeader() {
        return headers.getFirst(HttpHeaders.LINK);
    }
}
