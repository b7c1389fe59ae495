// Part of Resourcegraph
package com.machinezoo.resourcegraph.view;

import java.util.*;
import com.google.common.collect.*;

/*
 * Snapshot of the object graph. Maps preserve discovery order, root first,
 * which keeps rendering stable across repeated snapshots of the same traversal.
 */
/**
 * Rendered relationship graph of a cluster object.
 * Instances are immutable. Further traversal produces a new instance.
 */
public class ResourceViewerComponent implements Component {
	public static final String TYPE = "resourceViewer";
	public static final String TITLE = "Resource Viewer";
	private final ImmutableMap<String, Node> nodes;
	public Map<String, Node> nodes() {
		return nodes;
	}
	private final ImmutableMap<String, ImmutableList<Edge>> edges;
	public Map<String, ImmutableList<Edge>> edges() {
		return edges;
	}
	private final String selected;
	/**
	 * Gets id of the node the graph was built for.
	 * 
	 * @return id of the root node
	 */
	public String selected() {
		return selected;
	}
	public ResourceViewerComponent(Map<String, Node> nodes, Map<String, ? extends List<Edge>> edges, String selected) {
		this.nodes = ImmutableMap.copyOf(nodes);
		ImmutableMap.Builder<String, ImmutableList<Edge>> copy = ImmutableMap.builder();
		for (Map.Entry<String, ? extends List<Edge>> entry : edges.entrySet())
			copy.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
		this.edges = copy.build();
		this.selected = selected != null ? selected : "";
	}
	public List<Edge> edges(String node) {
		ImmutableList<Edge> outgoing = edges.get(node);
		return outgoing != null ? outgoing : ImmutableList.of();
	}
	@Override
	public ComponentMetadata metadata() {
		return new ComponentMetadata(TYPE, ImmutableList.of(new Text(TITLE)));
	}
	@Override
	public boolean empty() {
		return nodes.isEmpty();
	}
	@Override public boolean equals(Object obj) {
		if (!(obj instanceof ResourceViewerComponent))
			return false;
		ResourceViewerComponent other = (ResourceViewerComponent)obj;
		return nodes.equals(other.nodes) && edges.equals(other.edges) && selected.equals(other.selected);
	}
	@Override public int hashCode() {
		return Objects.hash(nodes, edges, selected);
	}
	@Override public String toString() {
		return TITLE + nodes.keySet();
	}
}
