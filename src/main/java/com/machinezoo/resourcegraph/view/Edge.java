// Part of Resourcegraph
package com.machinezoo.resourcegraph.view;

import java.util.*;

/**
 * Outgoing relationship of a {@link Node}. The source node is the key under which the edge is stored.
 */
public class Edge {
	public static enum Type {
		/*
		 * Relationship reported by queryer.
		 */
		EXPLICIT,
		/*
		 * Relationship inferred by the renderer, e.g. from label selectors.
		 */
		IMPLICIT
	}
	private final String node;
	/**
	 * Gets id of the target node.
	 * 
	 * @return target node id
	 */
	public String node() {
		return node;
	}
	private final Type type;
	public Type type() {
		return type;
	}
	public Edge(String node, Type type) {
		Objects.requireNonNull(node);
		Objects.requireNonNull(type);
		this.node = node;
		this.type = type;
	}
	@Override public boolean equals(Object obj) {
		if (!(obj instanceof Edge))
			return false;
		Edge other = (Edge)obj;
		return node.equals(other.node) && type == other.type;
	}
	@Override public int hashCode() {
		return Objects.hash(node, type);
	}
	@Override public String toString() {
		return "-> " + node + " (" + type.name().toLowerCase() + ")";
	}
}
