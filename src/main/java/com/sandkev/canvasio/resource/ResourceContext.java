package com.sandkev.canvasio.resource;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.canvasio.pagination.PaginationAggregator;
import com.sandkev.canvasio.scheduler.RequestScheduler;

import java.util.LinkedHashMap;
import java.util.Map;

/** What every node and collection of one client shares. */
public record ResourceContext(RequestScheduler scheduler,
                              PaginationAggregator pagination,
                              ObjectMapper mapper,
                              int perPage) {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {};

    /** Field map of a JSON object; anything else yields an empty map. */
    Map<String, Object> toFields(JsonNode body) {
        if (body == null || !body.isObject()) return new LinkedHashMap<>();
        return mapper.convertValue(body, FIELDS);
    }

    /** Deep copy, so nested maps and lists are not shared between snapshots. */
    Map<String, Object> copy(Map<String, Object> fields) {
        if (fields == null) return new LinkedHashMap<>();
        return mapper.convertValue(fields, FIELDS);
    }
}
