// Part of Resourcegraph
package com.machinezoo.resourcegraph.visitor;

import java.util.*;
import com.machinezoo.resourcegraph.objects.*;
import com.machinezoo.resourcegraph.util.*;
import com.machinezoo.resourcegraph.view.*;
import com.machinezoo.stagean.*;

/*
 * Graph is written by the traversal thread and read by whoever takes snapshots,
 * typically the thread serving a cache miss. All methods are therefore synchronized.
 * Nodes and edges are kept in insertion order, so snapshots list the root first
 * and then objects in the order they were discovered.
 */
/**
 * Mutable graph of cluster objects and their relationships, populated by a {@link Visitor}.
 * Nodes are never removed except for the pending root node, which is replaced when the root resolves.
 */
@DraftApi("graph-level queries for renderers")
public class ObjectGraph {
	private final Map<NodeKey, Node> nodes = new LinkedHashMap<>();
	private final Map<NodeKey, Set<NodeKey>> edges = new LinkedHashMap<>();
	private NodeKey root;
	private ObjectKey rootKey;
	public ObjectGraph() {
		OwnerTrace.of(this).alias("graph");
	}
	private static Node node(ClusterObject object, String path) {
		ObjectMetadata metadata = object.metadata();
		return new Node(metadata.name(), object.apiVersion(), object.kind(), metadata.namespace(), path);
	}
	/**
	 * Inserts placeholder root node under {@link NodeKey#PENDING} if the graph is still empty.
	 *
	 * @param object
	 *            root object, used to name the placeholder
	 * @return {@code true} if the placeholder was inserted
	 */
	public synchronized boolean seed(ClusterObject object) {
		Objects.requireNonNull(object);
		if (!nodes.isEmpty())
			return false;
		nodes.put(NodeKey.PENDING, node(object, ""));
		root = NodeKey.PENDING;
		OwnerTrace.of(this).tag("root", object.metadata().name());
		return true;
	}
	/*
	 * Rewrites the pending root in place. Edges pointing from or to the placeholder are retargeted,
	 * and the resolved node takes the placeholder's position at the head of the node map.
	 */
	/**
	 * Records identity of the root object, replacing the pending placeholder if there is one.
	 *
	 * @param object
	 *            root object
	 * @param path
	 *            display path of the root object
	 * @return resolved key of the root node
	 */
	public synchronized NodeKey resolve(ClusterObject object, String path) {
		Objects.requireNonNull(object);
		ObjectKey key = ObjectKey.of(object);
		NodeKey resolved = NodeKey.of(object);
		Node node = node(object, path);
		if (nodes.containsKey(NodeKey.PENDING)) {
			Map<NodeKey, Node> reordered = new LinkedHashMap<>();
			for (Map.Entry<NodeKey, Node> entry : nodes.entrySet()) {
				if (entry.getKey().pending())
					reordered.put(resolved, node);
				else if (!entry.getKey().equals(resolved))
					reordered.put(entry.getKey(), entry.getValue());
			}
			nodes.clear();
			nodes.putAll(reordered);
			retarget(NodeKey.PENDING, resolved);
		} else
			nodes.put(resolved, node);
		root = resolved;
		rootKey = key;
		OwnerTrace.of(this).tag("root", key);
		return resolved;
	}
	private void retarget(NodeKey from, NodeKey to) {
		Set<NodeKey> outgoing = edges.remove(from);
		if (outgoing != null) {
			outgoing.remove(to);
			if (!outgoing.isEmpty())
				edges.computeIfAbsent(to, k -> new LinkedHashSet<>()).addAll(outgoing);
		}
		for (Map.Entry<NodeKey, Set<NodeKey>> entry : edges.entrySet())
			if (entry.getValue().remove(from) && !entry.getKey().equals(to))
				entry.getValue().add(to);
	}
	/**
	 * Adds node for the object unless the graph already has one.
	 *
	 * @param object
	 *            object to add
	 * @return {@code true} if the node was added, {@code false} if it already existed
	 */
	public synchronized boolean add(ClusterObject object) {
		NodeKey key = NodeKey.of(object);
		if (nodes.containsKey(key))
			return false;
		nodes.put(key, node(object, ""));
		return true;
	}
	/**
	 * Adds edge between two nodes unless the same edge already exists.
	 *
	 * @param parent
	 *            source node
	 * @param child
	 *            target node
	 * @return {@code true} if the edge was added
	 */
	public synchronized boolean link(NodeKey parent, NodeKey child) {
		Objects.requireNonNull(parent);
		Objects.requireNonNull(child);
		if (parent.equals(child))
			return false;
		return edges.computeIfAbsent(parent, k -> new LinkedHashSet<>()).add(child);
	}
	public synchronized boolean contains(NodeKey key) {
		return nodes.containsKey(key);
	}
	public synchronized int size() {
		return nodes.size();
	}
	/**
	 * Gets key of the root node.
	 *
	 * @return root node key, {@link NodeKey#PENDING} before resolution, or empty if the graph was never seeded
	 */
	public synchronized Optional<NodeKey> root() {
		return Optional.ofNullable(root);
	}
	/**
	 * Gets identity of the root object once it is resolved.
	 *
	 * @return key of the root object or empty while the root is pending
	 */
	public synchronized Optional<ObjectKey> rootKey() {
		return Optional.ofNullable(rootKey);
	}
	public synchronized ResourceViewerComponent snapshot() {
		Map<String, Node> exported = new LinkedHashMap<>();
		for (Map.Entry<NodeKey, Node> entry : nodes.entrySet())
			exported.put(entry.getKey().id(), entry.getValue());
		Map<String, List<Edge>> links = new LinkedHashMap<>();
		for (Map.Entry<NodeKey, Set<NodeKey>> entry : edges.entrySet()) {
			List<Edge> outgoing = new ArrayList<>();
			for (NodeKey target : entry.getValue())
				outgoing.add(new Edge(target.id(), Edge.Type.EXPLICIT));
			if (!outgoing.isEmpty())
				links.put(entry.getKey().id(), outgoing);
		}
		return new ResourceViewerComponent(exported, links, root != null ? root.id() : "");
	}
	@Override public synchronized String toString() {
		return OwnerTrace.of(this) + " = " + nodes.keySet();
	}
}
