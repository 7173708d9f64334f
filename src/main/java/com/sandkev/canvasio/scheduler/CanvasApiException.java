package com.sandkev.canvasio.scheduler;

import lombok.Getter;
import org.springframework.http.HttpMethod;

/**
 * Terminal failure of a call: a non-retryable status, or retries exhausted.
 * A status of {@code 0} means no response was ever received.
 */
@Getter
public class CanvasApiException extends RuntimeException {

    private final HttpMethod method;
    private final String url;
    private final int status;
    private final String responseBody;

    public CanvasApiException(HttpMethod method, String url, int status, String responseBody) {
        this(method, url, status, responseBody, null);
    }

    public CanvasApiException(HttpMethod method, String url, int status, String responseBody, Throwable cause) {
        super("Canvas " + method + " " + url + " failed"
                + (status > 0 ? " with status " + status : "")
                + (responseBody == null || responseBody.isBlank() ? "" : ": " + responseBody), cause);
        this.method = method;
        this.url = url;
        this.status = status;
        this.responseBody = responseBody;
    }

    public boolean isNotFound() {
        return status == 404;
    }
}
