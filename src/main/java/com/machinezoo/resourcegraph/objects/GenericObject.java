// Part of Resourcegraph
package com.machinezoo.resourcegraph.objects;

import java.util.*;
import com.google.common.collect.*;

/**
 * {@link ClusterObject} with arbitrary content fields such as status next to its identity.
 * Instances are immutable.
 */
public class GenericObject implements ClusterObject {
	private final String apiVersion;
	@Override
	public String apiVersion() {
		return apiVersion;
	}
	private final String kind;
	@Override
	public String kind() {
		return kind;
	}
	private final ObjectMetadata metadata;
	@Override
	public ObjectMetadata metadata() {
		return metadata;
	}
	private final ImmutableMap<String, Object> content;
	public Map<String, Object> content() {
		return content;
	}
	public GenericObject(String apiVersion, String kind, ObjectMetadata metadata, Map<String, Object> content) {
		Objects.requireNonNull(metadata);
		this.apiVersion = apiVersion != null ? apiVersion : "";
		this.kind = kind != null ? kind : "";
		this.metadata = metadata;
		this.content = content != null ? ImmutableMap.copyOf(content) : ImmutableMap.of();
	}
	public GenericObject(String apiVersion, String kind, ObjectMetadata metadata) {
		this(apiVersion, kind, metadata, null);
	}
	public GenericObject with(String field, Object value) {
		Objects.requireNonNull(field);
		Objects.requireNonNull(value);
		Map<String, Object> updated = new LinkedHashMap<>(content);
		updated.put(field, value);
		return new GenericObject(apiVersion, kind, metadata, updated);
	}
	public GenericObject with(ObjectMetadata metadata) {
		return new GenericObject(apiVersion, kind, metadata, content);
	}
	@Override public boolean equals(Object obj) {
		if (!(obj instanceof GenericObject))
			return false;
		GenericObject other = (GenericObject)obj;
		return apiVersion.equals(other.apiVersion)
			&& kind.equals(other.kind)
			&& metadata.equals(other.metadata)
			&& content.equals(other.content);
	}
	@Override public int hashCode() {
		return Objects.hash(apiVersion, kind, metadata, content);
	}
	@Override public String toString() {
		return kind + " " + metadata;
	}
}
