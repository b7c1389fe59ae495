// Part of Resourcegraph
package com.machinezoo.resourcegraph.visitor;

import java.util.*;
import com.machinezoo.resourcegraph.*;
import com.machinezoo.resourcegraph.objects.*;

/**
 * Source of relationships between cluster objects.
 * 
 * @see OwnerQueryer
 */
@FunctionalInterface
public interface Queryer {
	/**
	 * Lists direct children of an object.
	 * 
	 * @param context
	 *            cancellation context of the calling traversal
	 * @param object
	 *            parent object
	 * @return children of the object in stable order, possibly empty
	 */
	List<ClusterObject> children(TraversalContext context, ClusterObject object);
}
