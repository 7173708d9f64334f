package com.sandkev.canvasio.shared.http;

/** Connection-level failure: no HTTP status was received. Always considered transient. */
public class CanvasTransportException extends RuntimeException {

    public CanvasTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
