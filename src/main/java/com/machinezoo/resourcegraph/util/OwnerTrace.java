// Part of Resourcegraph
package com.machinezoo.resourcegraph.util;

import java.util.*;
import java.util.concurrent.atomic.*;
import com.google.common.cache.*;
import io.opentracing.*;

/*
 * Caches, viewers, and traversal contexts are owned by one another, but that ownership is invisible
 * in logs and traces, because background traversals run on pool threads with no useful call stack.
 * OwnerTrace attaches an alias, identifying tags, and a parent to any object,
 * so that toString() and tracing spans can show the whole ownership chain.
 *
 * Data is kept in a weak-keyed Guava cache, which compares keys by identity.
 * That keeps objects with value equality (keys, components) from sharing trace data.
 * Trace data must not reference its target, otherwise the weak key would never be collected.
 */
/**
 * Diagnostic ownership information attached to arbitrary objects.
 *
 * @param <T>
 *            type of the traced object
 */
public class OwnerTrace<T> {
	private static final LoadingCache<Object, TraceData> all = CacheBuilder.newBuilder()
		.weakKeys()
		.build(CacheLoader.from(TraceData::new));
	public static <T> OwnerTrace<T> of(T target) {
		Objects.requireNonNull(target);
		return new OwnerTrace<>(target, all.getUnchecked(target));
	}
	private final T target;
	public T target() {
		return target;
	}
	private final TraceData data;
	private OwnerTrace(T target, TraceData data) {
		this.target = target;
		this.data = data;
	}
	private static class TraceData {
		volatile String alias;
		volatile Map<String, Object> tags = Collections.emptyMap();
		volatile TraceData parent;
		TraceData(Object target) {
			alias = target.getClass().getSimpleName();
		}
	}
	public OwnerTrace<T> alias(String alias) {
		Objects.requireNonNull(alias);
		data.alias = alias;
		return this;
	}
	public String alias() {
		return data.alias;
	}
	/*
	 * Tags are rarely written and often read. Copy-on-write keeps readers lock-free.
	 * Null values are ignored, which lets callers tag optional properties without checks.
	 */
	public OwnerTrace<T> tag(String key, Object value) {
		Objects.requireNonNull(key);
		if (value != null) {
			synchronized (data) {
				Map<String, Object> updated = new TreeMap<>(data.tags);
				updated.put(key, value);
				data.tags = Collections.unmodifiableMap(updated);
			}
		}
		return this;
	}
	public Map<String, Object> tags() {
		return data.tags;
	}
	private static final AtomicLong counter = new AtomicLong();
	public OwnerTrace<T> generateId() {
		return tag("id", counter.incrementAndGet());
	}
	public OwnerTrace<T> parent(Object parent) {
		Objects.requireNonNull(parent);
		data.parent = parent instanceof OwnerTrace ? ((OwnerTrace<?>)parent).data : all.getUnchecked(parent);
		return this;
	}
	/*
	 * Own tags go in unprefixed. Ancestor tags are prefixed with ancestor's alias.
	 * Ancestors without tags are still recorded as boolean flags, so that the ownership chain is visible.
	 */
	private Map<String, Object> flatten() {
		Map<String, Object> flat = new TreeMap<>(data.tags);
		for (TraceData ancestor = data.parent; ancestor != null; ancestor = ancestor.parent) {
			Map<String, Object> tags = ancestor.tags;
			if (tags.isEmpty())
				flat.putIfAbsent(ancestor.alias, true);
			else {
				for (Map.Entry<String, Object> tag : tags.entrySet())
					flat.putIfAbsent(ancestor.alias + "." + tag.getKey(), tag.getValue());
			}
		}
		return flat;
	}
	public Span fill(Span span) {
		Objects.requireNonNull(span);
		Map<String, Object> flat = flatten();
		if (flat.isEmpty())
			span.setTag(data.alias, true);
		for (Map.Entry<String, Object> tag : flat.entrySet()) {
			Object value = tag.getValue();
			if (value instanceof String)
				span.setTag(tag.getKey(), (String)value);
			else if (value instanceof Number)
				span.setTag(tag.getKey(), (Number)value);
			else if (value instanceof Boolean)
				span.setTag(tag.getKey(), (Boolean)value);
			else
				span.setTag(tag.getKey(), value.toString());
		}
		return span;
	}
	@Override public String toString() {
		return data.alias + flatten();
	}
}
