package com.sandkev.canvasio.shared.http;

import com.sandkev.canvasio.scheduler.PendingCall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Canvas over Spring WebFlux. The WebClient carries the bearer header. Relative urls are
 * resolved against {@code baseUrl}; absolute urls (page links) are already encoded and sent
 * as-is. Query keys and values are escaped completely, so a cursor holding {@code +} or
 * {@code &} reaches Canvas unchanged.
 */
@Slf4j
@RequiredArgsConstructor
public class WebClientCanvasTransport implements CanvasTransport {

    private final WebClient canvasWebClient;
    private final String baseUrl;

    @Override
    public Mono<ApiResponse> exchange(PendingCall call) {
        WebClient.RequestBodySpec spec = canvasWebClient.method(call.method()).uri(toUri(call));
        spec.accept(MediaType.APPLICATION_JSON);

        WebClient.RequestHeadersSpec<?> request = spec;
        if (call.body() != null && !HttpMethod.GET.equals(call.method())) {
            request = spec.contentType(MediaType.APPLICATION_JSON).bodyValue(call.body());
        }

        return request.exchangeToMono(r -> r.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new ApiResponse(r.statusCode().value(), r.headers().asHttpHeaders(), body)))
                .onErrorMap(WebClientRequestException.class,
                        e -> new CanvasTransportException("Canvas " + call.method() + " " + call.url() + " unreachable: " + e.getMessage(), e));
    }

    private URI toUri(PendingCall call) {
        String target = isAbsolute(call.url())
                ? call.url()
                : UriComponentsBuilder.fromUriString(baseUrl).path(call.url()).build().encode().toUriString();
        String query = toQueryString(call.query());
        if (query.isEmpty()) return URI.create(target);
        return URI.create(target + (target.contains("?") ? "&" : "?") + query);
    }

    private static boolean isAbsolute(String url) {
        return url.startsWith("http://") || url.startsWith("https://");
    }

    private static String toQueryString(@Nullable Map<String, Object> params) {
        var pairs = new StringJoiner("&");
        if (params != null) {
            params.forEach((k, v) -> {
                if (v instanceof Collection<?> c) {
                    c.forEach(item -> { if (item != null) pairs.add(pair(k, item)); });
                } else if (v != null) {
                    pairs.add(pair(k, v));
                }
            });
        }
        return pairs.toString();
    }

    private static String pair(String key, Object value) {
        return UriUtils.encode(key, StandardCharsets.UTF_8) + "=" + UriUtils.encode(String.valueOf(value), StandardCharsets.UTF_8);
    }
}
