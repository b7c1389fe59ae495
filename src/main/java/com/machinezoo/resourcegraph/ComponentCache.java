// Part of Resourcegraph
package com.machinezoo.resourcegraph;

import java.util.*;
import java.util.concurrent.*;
import org.slf4j.*;
import com.google.common.cache.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.resourcegraph.objects.*;
import com.machinezoo.resourcegraph.util.*;
import com.machinezoo.resourcegraph.view.*;
import com.machinezoo.resourcegraph.visitor.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;
import io.opentracing.*;
import io.opentracing.tag.Tags;
import io.opentracing.util.*;

/*
 * Cache miss is served in two phases:
 * - Synchronous phase creates a new resource viewer, renders its placeholder graph (root node under pending key),
 *   stores it under object's key, and returns it to the caller.
 * - Background phase traverses the graph and replaces the cache entry with the complete graph.
 * The caller thus sees something immediately and the next call sees the complete graph.
 *
 * Resolved key is derived from the same object as the original key, so the two always coincide for the default visitor.
 * Resolution therefore replaces the placeholder entry instead of adding a second one.
 * If a custom visitor resolves the root to a different key, the complete graph is stored under both keys,
 * so that neither of them keeps serving the stale placeholder.
 *
 * Concurrent misses for the same key are coalesced. The first caller performs both phases.
 * Other callers wait only for the synchronous phase and then return the same placeholder.
 * Cache hits never wait for anything.
 *
 * Failed traversal leaves the placeholder entry in place. Cancelled traversal does the same.
 * The entry is never replaced with partial graph.
 */
/**
 * LRU cache of rendered relationship graphs keyed by {@link ObjectKey}.
 * First request for an object returns placeholder graph and starts background traversal.
 * Requests made after the traversal completes return the complete graph:
 * 
 * <pre>{@code
 * ComponentCache cache = new ComponentCache(config).queryer(new OwnerQueryer(store));
 * Component placeholder = cache.get(context, deployment);
 * cache.resolution(ObjectKey.of(deployment)).ifPresent(CompletableFuture::join);
 * Component complete = cache.get(context, deployment);
 * }</pre>
 * 
 * Failed or cancelled traversal leaves the placeholder in the cache until it is evicted or invalidated.
 */
public class ComponentCache {
	private static final Logger logger = LoggerFactory.getLogger(ComponentCache.class);
	private static final Counter hitCount = Metrics.counter("resourcegraph.cache.hits");
	private static final Counter missCount = Metrics.counter("resourcegraph.cache.misses");
	private static final Counter evictionCount = Metrics.counter("resourcegraph.cache.evictions");
	private static final Timer timer = Metrics.timer("resourcegraph.traversal.evals");
	private static final Counter exceptionCount = Metrics.counter("resourcegraph.traversal.exceptions");
	public static final int DEFAULT_CAPACITY = 100;
	private final ViewerConfig config;
	public ViewerConfig config() {
		return config;
	}
	/**
	 * Creates empty cache. Queryer must be set before the cache can serve requests.
	 *
	 * @param config
	 *            collaborators supplied by the application
	 * @throws ConfigurationException
	 *             if configuration or its object store is missing
	 */
	public ComponentCache(ViewerConfig config) {
		if (config == null)
			throw new ConfigurationException("Component cache requires configuration.");
		if (config.objectStore() == null)
			throw new ConfigurationException("Component cache requires object store.");
		this.config = config;
		OwnerTrace.of(this).alias("components");
	}
	/*
	 * Capacity and executor can be configured until the cache is first used.
	 */
	private volatile Cache<ObjectKey, Component> components;
	private void ensureNotStarted() {
		if (components != null)
			throw new IllegalStateException("Cache is already in use.");
	}
	private int capacity = DEFAULT_CAPACITY;
	public synchronized int capacity() {
		return capacity;
	}
	public synchronized ComponentCache capacity(int capacity) {
		if (capacity <= 0)
			throw new IllegalArgumentException("Cache capacity must be positive.");
		ensureNotStarted();
		this.capacity = capacity;
		OwnerTrace.of(this).tag("capacity", capacity);
		return this;
	}
	private Executor executor = TraversalExecutor.common();
	public synchronized Executor executor() {
		return executor;
	}
	public synchronized ComponentCache executor(Executor executor) {
		Objects.requireNonNull(executor);
		ensureNotStarted();
		this.executor = executor;
		return this;
	}
	/*
	 * Queryer can be replaced at any time. Traversals already running keep the queryer they started with.
	 */
	private volatile Queryer queryer;
	public Optional<Queryer> queryer() {
		return Optional.ofNullable(queryer);
	}
	public ComponentCache queryer(Queryer queryer) {
		Objects.requireNonNull(queryer);
		this.queryer = queryer;
		return this;
	}
	/*
	 * Single segment makes Guava's size-based eviction strictly least-recently-used.
	 */
	private Cache<ObjectKey, Component> components() {
		Cache<ObjectKey, Component> current = components;
		if (current != null)
			return current;
		synchronized (this) {
			if (components == null) {
				RemovalListener<ObjectKey, Component> listener = notification -> {
					if (notification.wasEvicted()) {
						evictionCount.increment();
						logger.debug("Evicted resource graph of {}.", notification.getKey());
					}
				};
				components = CacheBuilder.newBuilder()
					.concurrencyLevel(1)
					.maximumSize(capacity)
					.removalListener(listener)
					.build();
			}
			return components;
		}
	}
	private static class Resolution {
		final CompletableFuture<Component> placeholder = new CompletableFuture<>();
		final CompletableFuture<ObjectKey> resolved = new CompletableFuture<>();
	}
	private final Map<ObjectKey, Resolution> resolutions = new HashMap<>();
	/**
	 * Gets graph of the object, rendering placeholder and starting background traversal on cache miss.
	 *
	 * @param context
	 *            cancellation context, also used by the background traversal
	 * @param object
	 *            root object of the graph
	 * @return cached graph, possibly still showing only the pending root node
	 * @throws NoQueryerConfiguredException
	 *             if no queryer was set
	 * @throws InvalidObjectException
	 *             if key of the object cannot be derived
	 */
	public Component get(TraversalContext context, ClusterObject object) {
		Objects.requireNonNull(context);
		Queryer queryer = this.queryer;
		if (queryer == null)
			throw new NoQueryerConfiguredException();
		ObjectKey key = ObjectKey.of(object);
		Cache<ObjectKey, Component> components = components();
		Component cached = components.getIfPresent(key);
		if (cached != null) {
			hitCount.increment();
			return cached;
		}
		Resolution resolution;
		boolean owner;
		synchronized (this) {
			cached = components.getIfPresent(key);
			if (cached != null) {
				hitCount.increment();
				return cached;
			}
			resolution = resolutions.get(key);
			owner = resolution == null;
			if (owner) {
				resolution = new Resolution();
				resolutions.put(key, resolution);
			}
		}
		if (!owner)
			return awaitPlaceholder(resolution);
		missCount.increment();
		logger.debug("Building resource graph of {}.", key);
		Component placeholder;
		CompletableFuture<ObjectKey> done;
		try {
			ResourceViewer viewer = newResourceViewer(queryer);
			placeholder = getComponent(object, viewer);
			components.put(key, placeholder);
			done = visit(context, key, object, viewer);
		} catch (RuntimeException ex) {
			finish(key, resolution, null, ex);
			throw ex;
		}
		resolution.placeholder.complete(placeholder);
		Resolution registered = resolution;
		done.whenComplete((resolved, ex) -> finish(key, registered, resolved, ex));
		return placeholder;
	}
	private static Component awaitPlaceholder(Resolution resolution) {
		try {
			return resolution.placeholder.join();
		} catch (CompletionException ex) {
			if (ex.getCause() instanceof RuntimeException)
				throw (RuntimeException)ex.getCause();
			throw ex;
		}
	}
	private void finish(ObjectKey key, Resolution resolution, ObjectKey resolved, Throwable exception) {
		PostLockQueue postlock = new PostLockQueue(this);
		postlock.run(() -> {
			resolutions.remove(key, resolution);
			if (exception != null) {
				postlock.post(() -> resolution.placeholder.completeExceptionally(exception));
				postlock.post(() -> resolution.resolved.completeExceptionally(exception));
			} else
				postlock.post(() -> resolution.resolved.complete(resolved));
		});
		if (exception instanceof CancellationException)
			logger.debug("Resolution of {} was cancelled.", key);
		else if (exception != null)
			logger.warn("Failed to resolve resource graph of {}.", key, exception);
	}
	/**
	 * Gets completion signal of background traversal that is currently running for the key.
	 *
	 * @param key
	 *            key of the root object
	 * @return future completed with resolved key, or empty if no traversal is running for the key
	 */
	public synchronized Optional<CompletableFuture<ObjectKey>> resolution(ObjectKey key) {
		Resolution resolution = resolutions.get(key);
		return resolution != null ? Optional.of(resolution.resolved) : Optional.empty();
	}
	ResourceViewer newResourceViewer() {
		Queryer queryer = this.queryer;
		if (queryer == null)
			throw new NoQueryerConfiguredException();
		return newResourceViewer(queryer);
	}
	private ResourceViewer newResourceViewer(Queryer queryer) {
		ResourceViewer viewer = new ResourceViewer(config, queryer);
		OwnerTrace.of(viewer).parent(this);
		return viewer;
	}
	/*
	 * Renders whatever the viewer has. Fresh viewer gets placeholder root node named after the object.
	 * Nothing is traversed and no collaborators are called here.
	 */
	Component getComponent(ClusterObject object, ResourceViewer viewer) {
		viewer.graph().seed(object);
		return viewer.component();
	}
	/*
	 * Exceptions are reported only through the returned future. Logging wrapper catches only what escapes,
	 * which is limited to errors rethrown after the future is completed.
	 */
	CompletableFuture<ObjectKey> visit(TraversalContext context, ObjectKey key, ClusterObject object, ResourceViewer viewer) {
		Objects.requireNonNull(context);
		Objects.requireNonNull(key);
		CompletableFuture<ObjectKey> done = new CompletableFuture<>();
		Timer.Sample sample = Timer.start();
		Runnable task = () -> {
			Tracer tracer = GlobalTracer.get();
			Span span = OwnerTrace.of(viewer).fill(tracer.buildSpan("resourcegraph.visit").start());
			try (Scope scope = tracer.activateSpan(span)) {
				ResourceViewerComponent component = viewer.visit(context, object);
				context.check();
				ObjectKey resolved = viewer.graph().rootKey().orElse(key);
				store(key, resolved, component);
				done.complete(resolved);
			} catch (Throwable ex) {
				exceptionCount.increment();
				Tags.ERROR.set(span, true);
				done.completeExceptionally(ex);
				if (ex instanceof Error)
					throw (Error)ex;
			} finally {
				span.finish();
				sample.stop(timer);
			}
		};
		try {
			executor().execute(ExceptionLogging.log(logger).runnable(task));
		} catch (RejectedExecutionException ex) {
			done.completeExceptionally(ex);
		}
		return done;
	}
	private void store(ObjectKey key, ObjectKey resolved, Component component) {
		Cache<ObjectKey, Component> components = components();
		components.put(resolved, component);
		if (!resolved.equals(key))
			components.put(key, component);
		logger.debug("Resolved resource graph of {} as {}.", key, resolved);
	}
	/**
	 * Gets cached graph without affecting LRU order or starting traversal.
	 *
	 * @param key
	 *            key of the root object
	 * @return cached graph or empty
	 */
	public Optional<Component> peek(ObjectKey key) {
		Objects.requireNonNull(key);
		// Map lookups record access in Guava's cache. Iteration does not.
		for (Map.Entry<ObjectKey, Component> entry : components().asMap().entrySet())
			if (entry.getKey().equals(key))
				return Optional.of(entry.getValue());
		return Optional.empty();
	}
	public boolean contains(ObjectKey key) {
		return components().asMap().containsKey(key);
	}
	public long size() {
		return components().size();
	}
	/**
	 * Drops cached graph of the object. Traversal already running for the key will store its result when it completes.
	 *
	 * @param key
	 *            key of the root object
	 */
	public void invalidate(ObjectKey key) {
		Objects.requireNonNull(key);
		components().invalidate(key);
	}
	public void invalidateAll() {
		components().invalidateAll();
	}
	@Override public String toString() {
		Cache<ObjectKey, Component> current = components;
		return OwnerTrace.of(this) + " = " + (current != null ? current.size() : 0) + " graphs";
	}
}
