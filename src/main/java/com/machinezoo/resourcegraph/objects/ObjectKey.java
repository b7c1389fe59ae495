// Part of Resourcegraph
package com.machinezoo.resourcegraph.objects;

import java.util.*;

/*
 * Keys are built only from identity metadata. Content, resource version, labels, and owner references
 * are excluded, so that an object keeps its key (and its cache entry) while it is being updated.
 * 
 * Uid is excluded as well. It is stable for the lifetime of the object, but objects are often
 * looked up by name before their uid is known, e.g. from URLs, and the cache must serve both.
 */
/**
 * Deterministic identity of a {@link ClusterObject} used as cache key and graph node key.
 * Keys are immutable, comparable, and consistent with {@link #equals(Object)}.
 */
public class ObjectKey implements Comparable<ObjectKey> {
	private final String apiVersion;
	public String apiVersion() {
		return apiVersion;
	}
	private final String kind;
	public String kind() {
		return kind;
	}
	private final String namespace;
	public String namespace() {
		return namespace;
	}
	private final String name;
	public String name() {
		return name;
	}
	public ObjectKey(String apiVersion, String kind, String namespace, String name) {
		this.apiVersion = apiVersion != null ? apiVersion : "";
		this.kind = kind != null ? kind : "";
		this.namespace = namespace != null ? namespace : "";
		this.name = name != null ? name : "";
		if (this.kind.isEmpty())
			throw new InvalidObjectException("Object key requires kind.");
		if (this.name.isEmpty())
			throw new InvalidObjectException("Object key requires name.");
	}
	/**
	 * Derives key from object's identity metadata.
	 * 
	 * @param object
	 *            object to derive the key from
	 * @return key of the object
	 * @throws InvalidObjectException
	 *             if the object is {@code null} or it lacks kind or name
	 */
	public static ObjectKey of(ClusterObject object) {
		if (object == null)
			throw new InvalidObjectException("Cannot derive key from null object.");
		ObjectMetadata metadata = object.metadata();
		if (metadata == null)
			throw new InvalidObjectException("Object of kind '" + object.kind() + "' has no metadata.");
		return new ObjectKey(object.apiVersion(), object.kind(), metadata.namespace(), metadata.name());
	}
	private static final Comparator<ObjectKey> order = Comparator
		.comparing(ObjectKey::apiVersion)
		.thenComparing(ObjectKey::kind)
		.thenComparing(ObjectKey::namespace)
		.thenComparing(ObjectKey::name);
	@Override
	public int compareTo(ObjectKey other) {
		return order.compare(this, other);
	}
	@Override public boolean equals(Object obj) {
		if (!(obj instanceof ObjectKey))
			return false;
		ObjectKey other = (ObjectKey)obj;
		return apiVersion.equals(other.apiVersion)
			&& kind.equals(other.kind)
			&& namespace.equals(other.namespace)
			&& name.equals(other.name);
	}
	@Override public int hashCode() {
		return Objects.hash(apiVersion, kind, namespace, name);
	}
	@Override public String toString() {
		String qualified = namespace.isEmpty() ? name : namespace + "/" + name;
		return apiVersion + ":" + kind + ":" + qualified;
	}
}
