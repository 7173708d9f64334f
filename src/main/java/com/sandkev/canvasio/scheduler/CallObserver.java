package com.sandkev.canvasio.scheduler;

import org.springframework.http.HttpMethod;

/**
 * Debug hook notified once per dispatched attempt. Fire-and-forget: the return is ignored and
 * anything it throws is logged and dropped.
 */
@FunctionalInterface
public interface CallObserver {

    CallObserver NONE = (method, url, body) -> {};

    void onDispatch(HttpMethod method, String url, Object body);
}
