package com.sandkev.canvasio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.canvasio.pagination.PaginationAggregator;
import com.sandkev.canvasio.resource.ResourceCollection;
import com.sandkev.canvasio.resource.ResourceContext;
import com.sandkev.canvasio.resource.ResourceKinds;
import com.sandkev.canvasio.resource.ResourceNode;
import com.sandkev.canvasio.scheduler.CallObserver;
import com.sandkev.canvasio.scheduler.CanvasResponse;
import com.sandkev.canvasio.scheduler.PendingCall;
import com.sandkev.canvasio.scheduler.RequestScheduler;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for the resource layer. Every node and collection handed out shares this
 * client's scheduler, so they all draw on the same quota.
 */
public class CanvasClient implements AutoCloseable {

    public static final String API_ROOT = "/api/v1";

    private final RequestScheduler scheduler;
    private final PaginationAggregator pagination;
    private final ResourceCollection courses;

    public CanvasClient(RequestScheduler scheduler, PaginationAggregator pagination, ObjectMapper mapper, int perPage) {
        this.scheduler = scheduler;
        this.pagination = pagination;
        var context = new ResourceContext(scheduler, pagination, mapper, perPage);
        this.courses = ResourceCollection.root(context, ResourceKinds.COURSE, API_ROOT + "/courses");
    }

    /**
     * The course with this id from {@link #courses()}. When it has not been loaded yet, an
     * unfetched shell is added; call {@code get()} or {@code getComplete()} to populate it.
     */
    public ResourceNode course(String id) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("course id is required");
        return courses.shell(id);
    }

    /** The courses this client holds. {@code get()} loads those visible to the token's user. */
    public ResourceCollection courses() {
        return courses;
    }

    public CompletableFuture<CanvasResponse> submit(PendingCall call) {
        return scheduler.submit(call);
    }

    public CompletableFuture<List<JsonNode>> fetchAll(PendingCall initialCall) {
        return pagination.fetchAll(initialCall);
    }

    public void setCallObserver(CallObserver observer) {
        scheduler.setObserver(observer);
    }

    public RequestScheduler scheduler() {
        return scheduler;
    }

    @Override
    public void close() {
        scheduler.close();
    }
}
