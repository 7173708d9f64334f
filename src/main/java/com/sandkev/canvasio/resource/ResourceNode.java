package com.sandkev.canvasio.resource;

import com.fasterxml.jackson.databind.JsonNode;
import com.sandkev.canvasio.scheduler.PendingCall;
import com.sandkev.canvasio.shared.Callbacks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;

/**
 * One remote Canvas object: its current fields, the snapshot taken at the last successful
 * sync, and one child collection per child kind.
 * <p>
 * A node is dirty when its fields differ from the snapshot, or when it has never been synced.
 * The parent link is weak and used for navigation only.
 */
@Slf4j
public class ResourceNode {

    private final ResourceContext ctx;
    private final ResourceKind kind;
    // path of the collection this node lives in; null until that collection's owner is saved
    @Nullable
    private volatile String basePath;
    private final WeakReference<ResourceCollection> parent;
    private final Map<String, ResourceCollection> children = new LinkedHashMap<>();

    @Nullable
    private final String shellId;
    private Map<String, Object> fields = new LinkedHashMap<>();
    @Nullable
    private Map<String, Object> originalFields;

    ResourceNode(ResourceContext ctx, ResourceKind kind, @Nullable String basePath,
                 @Nullable ResourceCollection parent, @Nullable String shellId) {
        this.ctx = ctx;
        this.kind = kind;
        this.basePath = basePath;
        this.parent = new WeakReference<>(parent);
        this.shellId = shellId;
        kind.children().forEach((name, childKind) ->
                children.put(name, new ResourceCollection(ctx, childKind, name, this, childPath(childKind))));
    }

    // ---- remote operations ----

    /** Fetches this object. Replaces fields and snapshot; unsaved local edits are discarded. */
    public CompletableFuture<ResourceNode> get() {
        String path = itemPath();
        return ctx.scheduler().submit(PendingCall.get(path)).thenApply(resp -> {
            if (isSynced() && isDirty()) {
                log.info("Discarding unsaved edits of {} {} on refetch", kind, getId());
            }
            absorb(resp.body());
            return this;
        });
    }

    public CompletableFuture<ResourceNode> get(BiConsumer<? super ResourceNode, ? super Throwable> callback) {
        return Callbacks.attach(get(), callback);
    }

    /** {@link #get()} followed by a full fetch of every child collection. */
    public CompletableFuture<ResourceNode> getComplete() {
        return get().thenCompose(n -> completeChildren());
    }

    public CompletableFuture<ResourceNode> getComplete(BiConsumer<? super ResourceNode, ? super Throwable> callback) {
        return Callbacks.attach(getComplete(), callback);
    }

    /**
     * Saves this node if dirty, then every dirty node below it. A never-synced node without an
     * id is created in its parent collection. Fails with {@link CascadeUpdateException} if any
     * write failed; everything that was written is clean afterwards.
     */
    public CompletableFuture<ResourceNode> update() {
        return updateSelf()
                .handle((v, err) -> err == null ? null : Callbacks.unwrap(err))
                .thenCompose(selfFailure -> {
                    var failures = new ArrayList<Throwable>();
                    if (selfFailure != null) {
                        failures.add(selfFailure);
                        if (getId() == null) {
                            // children cannot be addressed before this node exists remotely
                            return Cascade.settle(this, failures, "Update of " + kind + " failed");
                        }
                    }
                    List<CompletableFuture<ResourceCollection>> childUpdates = children.values().stream()
                            .map(ResourceCollection::update)
                            .toList();
                    return Cascade.failuresOf(childUpdates).thenCompose(childFailures -> {
                        failures.addAll(childFailures);
                        return Cascade.settle(this, failures, "Update of " + kind + " " + getId() + " failed");
                    });
                });
    }

    public CompletableFuture<ResourceNode> update(BiConsumer<? super ResourceNode, ? super Throwable> callback) {
        return Callbacks.attach(update(), callback);
    }

    /** Deletes this object remotely, then removes it from its parent collection. */
    public CompletableFuture<ResourceNode> delete() {
        String path = itemPath();
        return ctx.scheduler().submit(PendingCall.delete(path)).thenApply(resp -> {
            parent().ifPresent(c -> c.removeNode(this));
            return this;
        });
    }

    public CompletableFuture<ResourceNode> delete(BiConsumer<? super ResourceNode, ? super Throwable> callback) {
        return Callbacks.attach(delete(), callback);
    }

    // ---- state ----

    public ResourceKind kind() {
        return kind;
    }

    public synchronized boolean isSynced() {
        return originalFields != null;
    }

    public synchronized boolean isDirty() {
        return originalFields == null || !originalFields.equals(fields);
    }

    @Nullable
    public synchronized String getId() {
        Object id = fields.get(kind.idField());
        if (id == null && originalFields != null) id = originalFields.get(kind.idField());
        return id != null ? String.valueOf(id) : shellId;
    }

    @Nullable
    public String getTitle() {
        return stringField(kind.titleField());
    }

    public ResourceNode setTitle(String title) {
        return set(kind.titleField(), title);
    }

    @Nullable
    public String getHtml() {
        return kind.htmlField() == null ? null : stringField(kind.htmlField());
    }

    public ResourceNode setHtml(String html) {
        if (kind.htmlField() == null) throw new IllegalStateException(kind + " has no html field");
        return set(kind.htmlField(), html);
    }

    @Nullable
    public String getUrl() {
        return kind.urlField() == null ? null : stringField(kind.urlField());
    }

    @Nullable
    public synchronized Object get(String field) {
        return fields.get(field);
    }

    public synchronized ResourceNode set(String field, @Nullable Object value) {
        fields.put(field, value);
        return this;
    }

    /** Read-only copy of the current fields. */
    public synchronized Map<String, Object> fields() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public ResourceCollection collection(String name) {
        ResourceCollection c = children.get(name);
        if (c == null) throw new IllegalArgumentException(kind + " has no collection '" + name + "'");
        return c;
    }

    public Map<String, ResourceCollection> collections() {
        return Collections.unmodifiableMap(children);
    }

    public Optional<ResourceCollection> parent() {
        return Optional.ofNullable(parent.get());
    }

    // ---- internals ----

    String itemPath() {
        String id = getId();
        if (id == null || id.isBlank()) {
            throw new IllegalStateException(kind + " has no id yet; save it before addressing it");
        }
        return collectionPath() + "/" + id;
    }

    /** Follows a move of the owning collection, e.g. once an unsaved ancestor got its id. */
    void rebase(@Nullable String newBasePath) {
        basePath = newBasePath;
        rebaseChildren();
    }

    CompletableFuture<ResourceNode> completeChildren() {
        List<CompletableFuture<ResourceCollection>> fetches = children.values().stream()
                .map(ResourceCollection::getComplete)
                .toList();
        return CompletableFuture.allOf(fetches.toArray(CompletableFuture[]::new)).thenApply(v -> this);
    }

    /** Adopts a server representation as both fields and snapshot. */
    void absorb(JsonNode body) {
        synchronized (this) {
            fields = ctx.toFields(body);
            originalFields = ctx.copy(fields);
        }
        rebaseChildren();
    }

    private void rebaseChildren() {
        children.values().forEach(c -> c.rebase(childPath(c.kind())));
    }

    @Nullable
    private String childPath(ResourceKind childKind) {
        String base = basePath;
        String id = getId();
        if (base == null || id == null || id.isBlank()) return null;
        return base + "/" + id + "/" + childKind.pathSegment();
    }

    private String collectionPath() {
        String base = basePath;
        if (base == null) {
            throw new IllegalStateException(kind + " belongs to an unsaved object; save its owner first");
        }
        return base;
    }

    private CompletableFuture<Void> updateSelf() {
        Map<String, Object> sent;
        synchronized (this) {
            if (!isDirty()) return CompletableFuture.completedFuture(null);
            sent = ctx.copy(fields);
        }
        String id = getId();
        PendingCall call;
        if (id == null) {
            String target = collectionPath();
            log.debug("Creating {} in {}", kind, target);
            call = PendingCall.post(target, kind.wrapPayload(sent));
        } else if (sent.isEmpty()) {
            // unfetched shell: nothing to send
            return CompletableFuture.completedFuture(null);
        } else {
            call = PendingCall.put(itemPath(), kind.wrapPayload(sent));
        }
        return ctx.scheduler().submit(call).thenAccept(resp -> {
            resnapshot(sent, resp.body());
            rebaseChildren();
        });
    }

    /**
     * The snapshot becomes what was sent, overlaid with what the server echoed back. Fields edited
     * while the write was in flight stay as they are, and keep the node dirty.
     */
    private synchronized void resnapshot(Map<String, Object> sent, JsonNode body) {
        Map<String, Object> synced = new LinkedHashMap<>(sent);
        synced.putAll(ctx.toFields(body));
        boolean untouched = fields.equals(sent);
        originalFields = synced;
        if (untouched) {
            fields = ctx.copy(synced);
        }
    }

    @Nullable
    private synchronized String stringField(String field) {
        Object v = fields.get(field);
        return v == null ? null : String.valueOf(v);
    }

    @Override
    public String toString() {
        return kind + "[" + getId() + "]";
    }
}
