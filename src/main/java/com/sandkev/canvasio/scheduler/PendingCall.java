package com.sandkev.canvasio.scheduler;

import org.springframework.http.HttpMethod;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One logical request. GET calls carry {@code query}; POST/PUT/DELETE carry {@code body}.
 * The url is either an API path ({@code /api/v1/courses/1}) or an absolute url (page links).
 */
public record PendingCall(HttpMethod method, String url, Map<String, Object> query, @Nullable Object body) {

    public PendingCall {
        if (method == null) throw new IllegalArgumentException("method is required");
        if (url == null || url.isBlank()) throw new IllegalArgumentException("url is required");
        query = query == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(query));
    }

    public static PendingCall get(String url) {
        return new PendingCall(HttpMethod.GET, url, Map.of(), null);
    }

    public static PendingCall get(String url, Map<String, Object> query) {
        return new PendingCall(HttpMethod.GET, url, query, null);
    }

    public static PendingCall post(String url, Object body) {
        return new PendingCall(HttpMethod.POST, url, Map.of(), body);
    }

    public static PendingCall put(String url, Object body) {
        return new PendingCall(HttpMethod.PUT, url, Map.of(), body);
    }

    public static PendingCall delete(String url) {
        return new PendingCall(HttpMethod.DELETE, url, Map.of(), null);
    }

    /** Same method and body, different target. */
    public PendingCall withTarget(String url, Map<String, Object> query) {
        return new PendingCall(method, url, query, body);
    }

    /** What the debug hook reports as the payload: query for GET, body otherwise. */
    public Object payload() {
        return HttpMethod.GET.equals(method) ? query : body;
    }

    @Override
    public String toString() {
        return method + " " + url + (query.isEmpty() ? "" : " " + query);
    }
}
