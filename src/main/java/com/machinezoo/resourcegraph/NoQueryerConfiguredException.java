// Part of Resourcegraph
package com.machinezoo.resourcegraph;

/**
 * Thrown by {@link ComponentCache#get(TraversalContext, com.machinezoo.resourcegraph.objects.ClusterObject)}
 * when no {@link com.machinezoo.resourcegraph.visitor.Queryer} has been set yet.
 */
public class NoQueryerConfiguredException extends ResourceGraphException {
	private static final long serialVersionUID = 1L;
	public NoQueryerConfiguredException() {
		super("No queryer set.");
	}
}
