package com.sandkev.canvasio.pagination;

import com.fasterxml.jackson.databind.JsonNode;
import com.sandkev.canvasio.scheduler.PendingCall;
import com.sandkev.canvasio.scheduler.RequestScheduler;
import com.sandkev.canvasio.shared.Callbacks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;

/**
 * Follows {@code rel="next"} links until the last page and concatenates the items.
 * Pages are fetched strictly one after another, each through the scheduler.
 */
@Slf4j
@RequiredArgsConstructor
public class PaginationAggregator {

    private final RequestScheduler scheduler;

    public CompletableFuture<List<JsonNode>> fetchAll(PendingCall initialCall) {
        var items = new ArrayList<JsonNode>();
        return fetchPage(initialCall, initialCall, items, 1)
                .thenApply(pages -> {
                    log.info("Fetched {} item(s) in {} page(s) from {}", items.size(), pages, initialCall.url());
                    return Collections.unmodifiableList(items);
                });
    }

    public CompletableFuture<List<JsonNode>> fetchAll(PendingCall initialCall, BiConsumer<? super List<JsonNode>, ? super Throwable> callback) {
        return Callbacks.attach(fetchAll(initialCall), callback);
    }

    private CompletableFuture<Integer> fetchPage(PendingCall initial, PendingCall call, List<JsonNode> items, int page) {
        return scheduler.submit(call).thenCompose(resp -> {
            collect(resp.body(), items);
            if (!resp.cursor().hasNext()) {
                return CompletableFuture.completedFuture(page);
            }
            log.debug("Page {} of {} done, following {}", page, initial.url(), resp.cursor().nextUrl());
            return fetchPage(initial, followUp(initial, resp.cursor()), items, page + 1);
        });
    }

    /**
     * The next call targets the link's path and keeps the original query, with the link's own
     * parameters (the page cursor) taking precedence.
     */
    static PendingCall followUp(PendingCall initial, PageCursor cursor) {
        UriComponents next = UriComponentsBuilder.fromUriString(cursor.nextUrl()).build();

        Map<String, Object> query = new LinkedHashMap<>(initial.query());
        MultiValueMap<String, String> linkParams = next.getQueryParams();
        linkParams.forEach((rawKey, rawValues) -> {
            String key = decode(rawKey);
            List<String> values = rawValues.stream().map(PaginationAggregator::decode).toList();
            query.put(key, values.size() == 1 ? values.get(0) : values);
        });

        String target = UriComponentsBuilder.fromUriString(cursor.nextUrl())
                .replaceQuery(null)
                .fragment(null)
                .build()
                .toUriString();
        return initial.withTarget(target, query);
    }

    private static void collect(JsonNode body, List<JsonNode> items) {
        if (body == null || body.isNull() || body.isMissingNode()) return;
        if (body.isArray()) {
            body.forEach(items::add);
        } else {
            items.add(body);
        }
    }

    private static String decode(String s) {
        return s == null ? "" : UriUtils.decode(s, StandardCharsets.UTF_8);
    }
}
