package com.sandkev.canvasio.shared.http;

import com.sandkev.canvasio.scheduler.PendingCall;
import reactor.core.publisher.Mono;

public interface CanvasTransport {

    /**
     * Sends one attempt of the call. Every HTTP status is delivered as an {@link ApiResponse};
     * only connection-level problems error the Mono, with a {@link CanvasTransportException}.
     */
    Mono<ApiResponse> exchange(PendingCall call);
}
