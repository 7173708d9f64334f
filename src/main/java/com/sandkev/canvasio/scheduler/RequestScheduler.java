package com.sandkev.canvasio.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.sandkev.canvasio.pagination.PageCursor;
import com.sandkev.canvasio.quota.QuotaMonitor;
import com.sandkev.canvasio.shared.Callbacks;
import com.sandkev.canvasio.shared.http.ApiResponse;
import com.sandkev.canvasio.shared.http.CanvasTransport;
import com.sandkev.canvasio.shared.http.CanvasTransportException;
import com.sandkev.canvasio.shared.http.HttpRetrySupport;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;

/**
 * Self-throttling dispatcher for Canvas calls.
 * <p>
 * A single dispatcher thread admits queued calls into at most {@code callLimit} in-flight
 * exchanges, one start per {@code minSendInterval}, and only while the {@link QuotaMonitor}
 * allows it. The exchanges themselves are non-blocking; their completions feed the quota
 * reading back and either resolve the call or put it back at the head of the queue.
 * <p>
 * Admission is FIFO except that retried calls go to the front.
 */
@Slf4j
public class RequestScheduler implements AutoCloseable {

    private final CanvasTransport transport;
    private final QuotaMonitor quota;
    private final SchedulerSettings settings;
    private final ObjectMapper mapper;

    private final ReentrantLock queueLock = new ReentrantLock();
    private final Condition workAvailable = queueLock.newCondition();
    private final Deque<Attempt> queue = new ArrayDeque<>();

    private final Semaphore slots;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicBoolean probing = new AtomicBoolean();
    private final Thread dispatcher;

    private volatile boolean running = true;
    private volatile CallObserver observer = CallObserver.NONE;

    // dispatcher thread only
    private long lastDispatchNanos;
    private boolean dispatchedBefore;

    public RequestScheduler(CanvasTransport transport, QuotaMonitor quota, SchedulerSettings settings, ObjectMapper mapper) {
        this.transport = transport;
        this.quota = quota;
        this.settings = settings;
        this.mapper = mapper;
        this.slots = new Semaphore(settings.callLimit());
        quota.setStatusCheck(this::checkStatus);

        this.dispatcher = new Thread(this::dispatchLoop, "canvas-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
    }

    public CompletableFuture<CanvasResponse> submit(PendingCall call) {
        var attempt = new Attempt(call);
        if (!running) {
            attempt.result.completeExceptionally(new IllegalStateException("Scheduler is closed: " + call));
            return attempt.result;
        }
        enqueue(attempt, false);
        return attempt.result;
    }

    public CompletableFuture<CanvasResponse> submit(PendingCall call, BiConsumer<? super CanvasResponse, ? super Throwable> callback) {
        return Callbacks.attach(submit(call), callback);
    }

    public void setObserver(CallObserver observer) {
        this.observer = observer == null ? CallObserver.NONE : observer;
    }

    public QuotaMonitor quota() {
        return quota;
    }

    public int queuedCount() {
        queueLock.lock();
        try {
            return queue.size();
        } finally {
            queueLock.unlock();
        }
    }

    public int inFlightCount() {
        return inFlight.get();
    }

    /** Stops admitting calls; anything still queued fails with {@link IllegalStateException}. */
    @Override
    public void close() {
        if (!running) return;
        running = false;
        dispatcher.interrupt();

        List<Attempt> abandoned;
        queueLock.lock();
        try {
            abandoned = new ArrayList<>(queue);
            queue.clear();
        } finally {
            queueLock.unlock();
        }
        if (!abandoned.isEmpty()) log.warn("Scheduler closed with {} queued call(s)", abandoned.size());
        abandoned.forEach(a -> a.result.completeExceptionally(
                new IllegalStateException("Scheduler closed before dispatch: " + a.call)));
    }

    // ---- dispatcher ----

    private void dispatchLoop() {
        log.debug("Dispatcher started: callLimit={} minSendInterval={}", settings.callLimit(), settings.minSendInterval());
        while (running) {
            try {
                slots.acquire();
            } catch (InterruptedException e) {
                break;
            }
            Attempt next;
            try {
                awaitWork();
                quota.awaitCapacity();
                awaitStagger();
                next = pollHead();
            } catch (InterruptedException e) {
                slots.release();
                break;
            }
            if (next == null) {
                slots.release();
                continue;
            }
            if (!quota.mayProceed()) {
                enqueue(next, true);
                slots.release();
                continue;
            }
            dispatch(next);
        }
        log.debug("Dispatcher stopped");
    }

    private void dispatch(Attempt a) {
        a.dispatches++;
        inFlight.incrementAndGet();
        quota.consume(1);
        lastDispatchNanos = System.nanoTime();
        dispatchedBefore = true;
        notifyObserver(a.call);
        log.debug("Dispatch #{} {}", a.dispatches, a.call);

        Mono<ApiResponse> exchange;
        try {
            exchange = transport.exchange(a.call);
        } catch (RuntimeException e) {
            exchange = Mono.error(e);
        }
        exchange.toFuture().whenComplete((resp, err) -> settle(a, resp, err));
    }

    private void settle(Attempt a, ApiResponse resp, Throwable err) {
        try {
            if (err != null) {
                onFailure(a, unwrap(err));
            } else if (resp == null) {
                onFailure(a, new CanvasTransportException("No response for " + a.call, null));
            } else {
                onResponse(a, resp);
            }
        } catch (RuntimeException e) {
            a.result.completeExceptionally(e);
        } finally {
            inFlight.decrementAndGet();
            slots.release();
        }
    }

    private void onResponse(Attempt a, ApiResponse resp) {
        Double remaining = resp.rateLimitRemaining();
        if (remaining != null) quota.observe(remaining);

        int status = resp.status();
        PendingCall call = a.call;

        if (HttpRetrySupport.isSuccess(status)) {
            a.result.complete(new CanvasResponse(status, parse(call, resp), PageCursor.fromLinkHeader(resp.linkHeader())));
            return;
        }

        if (HttpRetrySupport.isQuotaRejection(status, resp.body())) {
            quota.observe(0);
            if (a.quotaRetries < settings.maxQuotaRetries()) {
                a.quotaRetries++;
                log.warn("Quota rejection {} on {}, requeued at front [{}/{}]",
                        status, call, a.quotaRetries, settings.maxQuotaRetries());
                retry(a);
                return;
            }
        } else if (HttpRetrySupport.isTransientServerError(status) && ++a.failures < settings.maxAttempts()) {
            log.warn("Status {} on {}, retrying [{}/{}]", status, call, a.failures, settings.maxAttempts());
            retry(a);
            return;
        }

        log.info("Canvas {} {} -> {}", call.method(), call.url(), status);
        a.result.completeExceptionally(new CanvasApiException(call.method(), call.url(), status, resp.body()));
    }

    private void onFailure(Attempt a, Throwable t) {
        PendingCall call = a.call;
        if (t instanceof CanvasTransportException && ++a.failures < settings.maxAttempts()) {
            log.warn("Transport failure on {}: {}, retrying [{}/{}]", call, t.getMessage(), a.failures, settings.maxAttempts());
            retry(a);
            return;
        }
        a.result.completeExceptionally(new CanvasApiException(call.method(), call.url(), 0, null, t));
    }

    private void retry(Attempt a) {
        if (!running) {
            a.result.completeExceptionally(new IllegalStateException("Scheduler closed before retry: " + a.call));
            return;
        }
        enqueue(a, true);
    }

    private JsonNode parse(PendingCall call, ApiResponse resp) {
        if (resp.body().isBlank()) return NullNode.getInstance();
        try {
            return mapper.readTree(resp.body());
        } catch (Exception e) {
            throw new CanvasApiException(call.method(), call.url(), resp.status(), resp.body(), e);
        }
    }

    private void notifyObserver(PendingCall call) {
        try {
            observer.onDispatch(call.method(), call.url(), call.payload());
        } catch (RuntimeException e) {
            log.warn("Call observer threw on {}: {}", call, e.toString());
        }
    }

    /** Refreshes the quota reading while dispatch is held and nothing else will report one. */
    private void checkStatus() {
        if (!running || settings.statusPath() == null || inFlight.get() > 0) return;
        if (!probing.compareAndSet(false, true)) return;

        PendingCall probe = PendingCall.get(settings.statusPath());
        log.debug("Probing quota with {}", probe);
        Mono<ApiResponse> exchange;
        try {
            exchange = transport.exchange(probe);
        } catch (RuntimeException e) {
            probing.set(false);
            throw e;
        }
        exchange.toFuture().whenComplete((resp, err) -> {
            probing.set(false);
            Double remaining = resp != null ? resp.rateLimitRemaining() : null;
            if (remaining != null) {
                quota.observe(remaining);
            } else {
                log.debug("Quota probe gave no reading: {}", err != null ? err.toString() : "status " + (resp != null ? resp.status() : "none"));
            }
        });
    }

    private void awaitStagger() throws InterruptedException {
        if (!dispatchedBefore) return;
        long wait = lastDispatchNanos + settings.minSendInterval().toNanos() - System.nanoTime();
        if (wait > 0) TimeUnit.NANOSECONDS.sleep(wait);
    }

    // ---- queue ----

    private void enqueue(Attempt a, boolean front) {
        queueLock.lock();
        try {
            if (front) queue.offerFirst(a);
            else queue.offerLast(a);
            workAvailable.signalAll();
        } finally {
            queueLock.unlock();
        }
        if (!running && removeQueued(a)) {
            a.result.completeExceptionally(new IllegalStateException("Scheduler is closed: " + a.call));
        }
    }

    private boolean removeQueued(Attempt a) {
        queueLock.lock();
        try {
            return queue.remove(a);
        } finally {
            queueLock.unlock();
        }
    }

    private void awaitWork() throws InterruptedException {
        queueLock.lock();
        try {
            while (queue.isEmpty()) {
                workAvailable.await();
            }
        } finally {
            queueLock.unlock();
        }
    }

    private Attempt pollHead() {
        queueLock.lock();
        try {
            return queue.pollFirst();
        } finally {
            queueLock.unlock();
        }
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }

    private static final class Attempt {
        final PendingCall call;
        final CompletableFuture<CanvasResponse> result = new CompletableFuture<>();
        int dispatches;
        int failures;
        int quotaRetries;

        Attempt(PendingCall call) {
            this.call = call;
        }
    }
}
