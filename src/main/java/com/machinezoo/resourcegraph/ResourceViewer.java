// Part of Resourcegraph
package com.machinezoo.resourcegraph;

import java.util.*;
import java.util.function.*;
import com.machinezoo.resourcegraph.objects.*;
import com.machinezoo.resourcegraph.util.*;
import com.machinezoo.resourcegraph.view.*;
import com.machinezoo.resourcegraph.visitor.*;

/*
 * Resource viewer is one traversal session. It owns the graph and the visitor that populates it.
 * Viewers are cheap and single-use. Cache creates a new viewer for every miss.
 * 
 * Visitor is created by a factory, because the visitor must write into the graph owned by this viewer.
 * Tests substitute their own visitors through the same factory.
 */
/**
 * Builds relationship graph of a cluster object and renders it as {@link ResourceViewerComponent}.
 */
public class ResourceViewer {
	private final ViewerConfig config;
	private final ObjectGraph graph = new ObjectGraph();
	public ObjectGraph graph() {
		return graph;
	}
	private final Visitor visitor;
	public Visitor visitor() {
		return visitor;
	}
	/**
	 * Creates viewer with custom visitor.
	 * 
	 * @param config
	 *            collaborators supplied by the application
	 * @param visitors
	 *            creates visitor writing into the viewer's graph
	 * @throws ConfigurationException
	 *             if configuration or object store is missing or the factory does not return a visitor
	 */
	public ResourceViewer(ViewerConfig config, Function<ObjectGraph, Visitor> visitors) {
		if (config == null)
			throw new ConfigurationException("Resource viewer requires configuration.");
		if (config.objectStore() == null)
			throw new ConfigurationException("Resource viewer requires object store.");
		if (visitors == null)
			throw new ConfigurationException("Resource viewer requires visitor.");
		this.config = config;
		OwnerTrace.of(this)
			.alias("viewer")
			.generateId();
		OwnerTrace.of(graph).parent(this);
		visitor = visitors.apply(graph);
		if (visitor == null)
			throw new ConfigurationException("Resource viewer requires visitor.");
	}
	/**
	 * Creates viewer with the default {@link GraphVisitor}.
	 * 
	 * @param config
	 *            collaborators supplied by the application
	 * @param queryer
	 *            source of child objects
	 * @throws ConfigurationException
	 *             if any collaborator is missing
	 */
	public ResourceViewer(ViewerConfig config, Queryer queryer) {
		this(config, defaultVisitors(config, queryer));
	}
	private static Function<ObjectGraph, Visitor> defaultVisitors(ViewerConfig config, Queryer queryer) {
		if (queryer == null)
			throw new ConfigurationException("Resource viewer requires queryer.");
		return graph -> config != null ? new GraphVisitor(config, queryer, graph) : null;
	}
	public ViewerConfig config() {
		return config;
	}
	/**
	 * Builds graph of everything reachable from the root object.
	 * Root node is shown under {@link NodeKey#PENDING} until the visitor resolves it.
	 * 
	 * @param context
	 *            cancellation context
	 * @param root
	 *            object to build the graph for
	 * @return rendered graph
	 * @throws InvalidObjectException
	 *             if key of the root object cannot be derived
	 * @throws ChildLookupException
	 *             if visitor failed to list children of some object, in which case the graph may be incomplete
	 * @throws TraversalCancelledException
	 *             if the context was cancelled
	 */
	public ResourceViewerComponent visit(TraversalContext context, ClusterObject root) {
		Objects.requireNonNull(context);
		ObjectKey key = ObjectKey.of(root);
		OwnerTrace.of(this).tag("key", key);
		graph.seed(root);
		visitor.visit(context, root);
		return graph.snapshot();
	}
	/**
	 * Renders current state of the graph without traversing anything.
	 * 
	 * @return rendered graph
	 */
	public ResourceViewerComponent component() {
		return graph.snapshot();
	}
	@Override public String toString() {
		return OwnerTrace.of(this) + " = " + graph.size() + " nodes";
	}
}
