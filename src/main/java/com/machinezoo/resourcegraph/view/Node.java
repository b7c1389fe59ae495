// Part of Resourcegraph
package com.machinezoo.resourcegraph.view;

import java.util.*;

/**
 * Graph node representing one cluster object.
 */
public class Node {
	private final String name;
	public String name() {
		return name;
	}
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
	private final String path;
	/**
	 * Gets display path of the object.
	 * 
	 * @return path or empty string if the path has not been resolved
	 */
	public String path() {
		return path;
	}
	public Node(String name, String apiVersion, String kind, String namespace, String path) {
		Objects.requireNonNull(name);
		this.name = name;
		this.apiVersion = apiVersion != null ? apiVersion : "";
		this.kind = kind != null ? kind : "";
		this.namespace = namespace != null ? namespace : "";
		this.path = path != null ? path : "";
	}
	public Node withPath(String path) {
		return new Node(name, apiVersion, kind, namespace, path);
	}
	@Override public boolean equals(Object obj) {
		if (!(obj instanceof Node))
			return false;
		Node other = (Node)obj;
		return name.equals(other.name)
			&& apiVersion.equals(other.apiVersion)
			&& kind.equals(other.kind)
			&& namespace.equals(other.namespace)
			&& path.equals(other.path);
	}
	@Override public int hashCode() {
		return Objects.hash(name, apiVersion, kind, namespace, path);
	}
	@Override public String toString() {
		return kind + " " + name;
	}
}
