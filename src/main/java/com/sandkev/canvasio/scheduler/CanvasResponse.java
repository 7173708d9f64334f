package com.sandkev.canvasio.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import com.sandkev.canvasio.pagination.PageCursor;

/** A successful response: parsed body plus the cursor to the next page, if any. */
public record CanvasResponse(int status, JsonNode body, PageCursor cursor) {
}
