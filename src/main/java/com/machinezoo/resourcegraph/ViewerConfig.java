// Part of Resourcegraph
package com.machinezoo.resourcegraph;

import com.machinezoo.resourcegraph.objects.*;

/**
 * Collaborators supplied by the hosting application.
 */
public interface ViewerConfig {
	/**
	 * Gets the object store. Required.
	 * 
	 * @return object store, never {@code null} in a valid configuration
	 */
	ObjectStore objectStore();
	/**
	 * Computes display path of an object, typically a URL fragment understood by the UI.
	 * 
	 * @param context
	 *            cancellation context of the calling traversal
	 * @param apiVersion
	 *            API group and version of the object
	 * @param kind
	 *            kind of the object
	 * @param name
	 *            name of the object
	 * @return display path
	 */
	String objectPath(TraversalContext context, String apiVersion, String kind, String name);
}
