package com.sandkev.canvasio.resource;

import com.fasterxml.jackson.databind.JsonNode;
import com.sandkev.canvasio.scheduler.PendingCall;
import com.sandkev.canvasio.shared.Callbacks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.stream.Stream;

/**
 * Ordered nodes of one kind, unique by id, owned by a parent node or by the client itself.
 * A {@link #get()} is a full resync: the previous nodes, and any edits on them, are dropped.
 */
@Slf4j
public class ResourceCollection implements Iterable<ResourceNode> {

    private final ResourceContext ctx;
    private final ResourceKind kind;
    private final String name;
    private final WeakReference<ResourceNode> owner;
    // null while the owner has not been created remotely
    @Nullable
    private volatile String path;
    private final List<ResourceNode> nodes = new ArrayList<>();

    ResourceCollection(ResourceContext ctx, ResourceKind kind, String name,
                       @Nullable ResourceNode owner, @Nullable String path) {
        this.ctx = ctx;
        this.kind = kind;
        this.name = name;
        this.owner = new WeakReference<>(owner);
        this.path = path;
    }

    /** A top-level collection addressed directly, e.g. {@code /api/v1/courses}. */
    public static ResourceCollection root(ResourceContext ctx, ResourceKind kind, String path) {
        return new ResourceCollection(ctx, kind, kind.pathSegment(), null, path);
    }

    // ---- remote operations ----

    public CompletableFuture<ResourceCollection> get() {
        String path = path();
        return ctx.pagination().fetchAll(PendingCall.get(path, Map.of("per_page", ctx.perPage()))).thenApply(items -> {
            var fresh = new LinkedHashMap<String, ResourceNode>();
            var anonymous = new ArrayList<ResourceNode>();
            for (JsonNode item : items) {
                ResourceNode node = nodeFrom(path, item);
                if (node.getId() == null) anonymous.add(node);
                else fresh.putIfAbsent(node.getId(), node);
            }
            synchronized (nodes) {
                nodes.clear();
                nodes.addAll(fresh.values());
                nodes.addAll(anonymous);
            }
            log.debug("Loaded {} {}(s) from {}", size(), kind, path);
            return this;
        });
    }

    public CompletableFuture<ResourceCollection> get(BiConsumer<? super ResourceCollection, ? super Throwable> callback) {
        return Callbacks.attach(get(), callback);
    }

    /** {@link #get()}, then the complete subtree of every node when this kind has children. */
    public CompletableFuture<ResourceCollection> getComplete() {
        if (!kind.hasChildren()) return get();
        return get().thenCompose(c -> {
            List<CompletableFuture<ResourceNode>> subtrees = snapshot().stream()
                    .map(ResourceNode::completeChildren)
                    .toList();
            return CompletableFuture.allOf(subtrees.toArray(CompletableFuture[]::new)).thenApply(v -> this);
        });
    }

    public CompletableFuture<ResourceCollection> getComplete(BiConsumer<? super ResourceCollection, ? super Throwable> callback) {
        return Callbacks.attach(getComplete(), callback);
    }

    /** Fetches one item; it replaces the node with the same id or is appended. */
    public CompletableFuture<ResourceNode> getOne(String id) {
        String path = path();
        return ctx.scheduler().submit(PendingCall.get(itemPath(path, id)))
                .thenApply(resp -> upsert(nodeFrom(path, resp.body())));
    }

    public CompletableFuture<ResourceNode> getOne(String id, BiConsumer<? super ResourceNode, ? super Throwable> callback) {
        return Callbacks.attach(getOne(id), callback);
    }

    public CompletableFuture<ResourceNode> getOneComplete(String id) {
        return getOne(id).thenCompose(ResourceNode::completeChildren);
    }

    public CompletableFuture<ResourceNode> getOneComplete(String id, BiConsumer<? super ResourceNode, ? super Throwable> callback) {
        return Callbacks.attach(getOneComplete(id), callback);
    }

    /** Creates an item from {@code data}; the returned node is clean. */
    public CompletableFuture<ResourceNode> create(Map<String, Object> data) {
        Objects.requireNonNull(data, "data");
        String path = path();
        return ctx.scheduler().submit(PendingCall.post(path, kind.wrapPayload(ctx.copy(data))))
                .thenApply(resp -> upsert(nodeFrom(path, resp.body())));
    }

    public CompletableFuture<ResourceNode> create(Map<String, Object> data, BiConsumer<? super ResourceNode, ? super Throwable> callback) {
        return Callbacks.attach(create(data), callback);
    }

    /** Saves every dirty node of this collection and below. */
    public CompletableFuture<ResourceCollection> update() {
        List<CompletableFuture<ResourceNode>> updates = snapshot().stream()
                .map(ResourceNode::update)
                .toList();
        return Cascade.failuresOf(updates)
                .thenCompose(failures -> Cascade.settle(this, failures, "Update of " + name + " failed"));
    }

    public CompletableFuture<ResourceCollection> update(BiConsumer<? super ResourceCollection, ? super Throwable> callback) {
        return Callbacks.attach(update(), callback);
    }

    /** Deletes the item remotely; the local node is only removed once the server confirmed. */
    public CompletableFuture<ResourceCollection> delete(String id) {
        String path = itemPath(path(), id);
        return ctx.scheduler().submit(PendingCall.delete(path)).thenApply(resp -> {
            synchronized (nodes) {
                nodes.removeIf(n -> id.equals(n.getId()));
            }
            return this;
        });
    }

    public CompletableFuture<ResourceCollection> delete(String id, BiConsumer<? super ResourceCollection, ? super Throwable> callback) {
        return Callbacks.attach(delete(id), callback);
    }

    // ---- local ----

    /**
     * Appends an unsaved node; the next {@link #update()} creates it. This also works below an
     * owner that is itself unsaved: the node is created once its owner exists remotely.
     */
    public ResourceNode add(Map<String, Object> data) {
        var node = new ResourceNode(ctx, kind, path, this, null);
        if (data != null) data.forEach(node::set);
        synchronized (nodes) {
            nodes.add(node);
        }
        return node;
    }

    /** The node with this id, or an unfetched shell for it appended to this collection. */
    public ResourceNode shell(String id) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");
        synchronized (nodes) {
            for (ResourceNode n : nodes) {
                if (id.equals(n.getId())) return n;
            }
            var node = new ResourceNode(ctx, kind, path(), this, id);
            nodes.add(node);
            return node;
        }
    }

    public Optional<ResourceNode> find(String id) {
        if (id == null) return Optional.empty();
        return snapshot().stream().filter(n -> id.equals(n.getId())).findFirst();
    }

    public List<ResourceNode> items() {
        return snapshot();
    }

    public Stream<ResourceNode> stream() {
        return snapshot().stream();
    }

    public int size() {
        synchronized (nodes) {
            return nodes.size();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public Iterator<ResourceNode> iterator() {
        return snapshot().iterator();
    }

    public String name() {
        return name;
    }

    public ResourceKind kind() {
        return kind;
    }

    public Optional<ResourceNode> owner() {
        return Optional.ofNullable(owner.get());
    }

    String path() {
        String p = path;
        if (p == null) {
            throw new IllegalStateException("Collection '" + name + "' belongs to an unsaved object; save its owner first");
        }
        return p;
    }

    /** Moves this collection, and every node in it, under a new path. */
    void rebase(@Nullable String newPath) {
        path = newPath;
        snapshot().forEach(n -> n.rebase(newPath));
    }

    void removeNode(ResourceNode node) {
        synchronized (nodes) {
            nodes.remove(node);
        }
    }

    // ---- internals ----

    private static String itemPath(String collectionPath, String id) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");
        return collectionPath + "/" + id;
    }

    private ResourceNode nodeFrom(String path, JsonNode body) {
        var node = new ResourceNode(ctx, kind, path, this, null);
        node.absorb(body);
        return node;
    }

    private ResourceNode upsert(ResourceNode node) {
        String id = node.getId();
        synchronized (nodes) {
            for (int i = 0; i < nodes.size(); i++) {
                if (id != null && id.equals(nodes.get(i).getId())) {
                    nodes.set(i, node);
                    return node;
                }
            }
            nodes.add(node);
        }
        return node;
    }

    private List<ResourceNode> snapshot() {
        synchronized (nodes) {
            return List.copyOf(nodes);
        }
    }

    @Override
    public String toString() {
        return name + "(" + size() + ")";
    }
}
