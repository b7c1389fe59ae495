// Part of Resourcegraph
package com.machinezoo.resourcegraph.visitor;

import java.util.*;
import com.machinezoo.resourcegraph.objects.*;

/*
 * Root node of a fresh graph is rendered before the root object is fully resolved.
 * It lives under the pending key until traversal confirms its identity and moves it to its resolved key.
 * The pending key keeps the "emptyID" wire form that renderers already recognize.
 */
/**
 * Key of a node in {@link ObjectGraph}, either {@link #PENDING} or resolved to object's identity.
 */
public final class NodeKey {
	public static final NodeKey PENDING = new NodeKey("emptyID", true);
	private final String id;
	public String id() {
		return id;
	}
	private final boolean pending;
	public boolean pending() {
		return pending;
	}
	private NodeKey(String id, boolean pending) {
		this.id = id;
		this.pending = pending;
	}
	public static NodeKey resolved(String id) {
		Objects.requireNonNull(id);
		if (id.isEmpty())
			throw new IllegalArgumentException("Node id cannot be empty.");
		if (id.equals(PENDING.id))
			throw new IllegalArgumentException("Node id '" + id + "' is reserved.");
		return new NodeKey(id, false);
	}
	/**
	 * Derives node key from object's uid, falling back to its {@link ObjectKey} if the uid is missing or reserved.
	 * 
	 * @param object
	 *            object represented by the node
	 * @return resolved node key
	 * @throws InvalidObjectException
	 *             if the object has no uid and its {@link ObjectKey} cannot be derived
	 */
	public static NodeKey of(ClusterObject object) {
		ObjectKey key = ObjectKey.of(object);
		String uid = object.metadata().uid();
		return resolved(!uid.isEmpty() && !uid.equals(PENDING.id) ? uid : key.toString());
	}
	@Override public boolean equals(Object obj) {
		if (!(obj instanceof NodeKey))
			return false;
		NodeKey other = (NodeKey)obj;
		return pending == other.pending && id.equals(other.id);
	}
	@Override public int hashCode() {
		return Objects.hash(id, pending);
	}
	@Override public String toString() {
		return pending ? "pending" : id;
	}
}
