// Part of Resourcegraph
package com.machinezoo.resourcegraph.objects;

import java.util.*;
import com.google.common.collect.*;

/*
 * Metadata is immutable. The with*() methods return modified copies,
 * which keeps test fixtures and queryer results free of aliasing surprises.
 */
/**
 * Identity and bookkeeping metadata of a {@link ClusterObject}.
 * Only name and namespace contribute to {@link ObjectKey}. The remaining fields may change
 * without affecting object identity.
 */
public class ObjectMetadata {
	private final String name;
	public String name() {
		return name;
	}
	private final String namespace;
	/**
	 * Gets namespace of the object.
	 * 
	 * @return namespace or empty string for cluster-scoped objects, never {@code null}
	 */
	public String namespace() {
		return namespace;
	}
	private final String uid;
	public String uid() {
		return uid;
	}
	private final String resourceVersion;
	public String resourceVersion() {
		return resourceVersion;
	}
	private final ImmutableMap<String, String> labels;
	public Map<String, String> labels() {
		return labels;
	}
	private final ImmutableList<OwnerReference> owners;
	public List<OwnerReference> owners() {
		return owners;
	}
	public ObjectMetadata(String name, String namespace, String uid, String resourceVersion, Map<String, String> labels, List<OwnerReference> owners) {
		this.name = name != null ? name : "";
		this.namespace = namespace != null ? namespace : "";
		this.uid = uid != null ? uid : "";
		this.resourceVersion = resourceVersion != null ? resourceVersion : "";
		this.labels = labels != null ? ImmutableMap.copyOf(labels) : ImmutableMap.of();
		this.owners = owners != null ? ImmutableList.copyOf(owners) : ImmutableList.of();
	}
	public ObjectMetadata(String name, String namespace) {
		this(name, namespace, null, null, null, null);
	}
	public ObjectMetadata withUid(String uid) {
		return new ObjectMetadata(name, namespace, uid, resourceVersion, labels, owners);
	}
	public ObjectMetadata withResourceVersion(String resourceVersion) {
		return new ObjectMetadata(name, namespace, uid, resourceVersion, labels, owners);
	}
	public ObjectMetadata withLabels(Map<String, String> labels) {
		return new ObjectMetadata(name, namespace, uid, resourceVersion, labels, owners);
	}
	public ObjectMetadata withOwners(List<OwnerReference> owners) {
		return new ObjectMetadata(name, namespace, uid, resourceVersion, labels, owners);
	}
	public boolean ownedBy(String uid) {
		if (uid == null || uid.isEmpty())
			return false;
		for (OwnerReference owner : owners)
			if (owner.uid().equals(uid))
				return true;
		return false;
	}
	@Override public boolean equals(Object obj) {
		if (!(obj instanceof ObjectMetadata))
			return false;
		ObjectMetadata other = (ObjectMetadata)obj;
		return name.equals(other.name)
			&& namespace.equals(other.namespace)
			&& uid.equals(other.uid)
			&& resourceVersion.equals(other.resourceVersion)
			&& labels.equals(other.labels)
			&& owners.equals(other.owners);
	}
	@Override public int hashCode() {
		return Objects.hash(name, namespace, uid, resourceVersion, labels, owners);
	}
	@Override public String toString() {
		return namespace.isEmpty() ? name : namespace + "/" + name;
	}
}
