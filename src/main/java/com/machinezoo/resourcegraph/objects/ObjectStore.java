// Part of Resourcegraph
package com.machinezoo.resourcegraph.objects;

import java.util.*;
import com.machinezoo.resourcegraph.*;

/**
 * Read access to objects stored in the cluster.
 * Implementations typically front a watch-based informer cache or an API client.
 */
public interface ObjectStore {
	/**
	 * Lists all objects in a namespace.
	 * 
	 * @param context
	 *            cancellation context of the calling traversal
	 * @param namespace
	 *            namespace to list, empty string for cluster-scoped objects
	 * @return objects in the namespace, never {@code null}
	 */
	List<ClusterObject> list(TraversalContext context, String namespace);
}
