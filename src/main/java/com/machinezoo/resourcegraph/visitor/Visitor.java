// Part of Resourcegraph
package com.machinezoo.resourcegraph.visitor;

import com.machinezoo.resourcegraph.*;
import com.machinezoo.resourcegraph.objects.*;

/**
 * Callback invoked for objects reachable from a root object.
 * Implementations decide how to discover and what to record.
 * 
 * @see GraphVisitor
 */
@FunctionalInterface
public interface Visitor {
	/**
	 * Visits the object and everything reachable from it.
	 * 
	 * @param context
	 *            cancellation context, checked before every child lookup
	 * @param object
	 *            root of the traversal
	 * @throws ChildLookupException
	 *             if children of some object could not be listed
	 * @throws TraversalCancelledException
	 *             if the context was cancelled during traversal
	 */
	void visit(TraversalContext context, ClusterObject object);
}
