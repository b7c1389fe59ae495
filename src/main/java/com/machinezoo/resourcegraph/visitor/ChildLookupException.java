// Part of Resourcegraph
package com.machinezoo.resourcegraph.visitor;

import com.machinezoo.resourcegraph.*;
import com.machinezoo.resourcegraph.objects.*;

/**
 * Thrown when {@link Queryer} fails to list children of an object.
 * The underlying failure is available as the cause.
 */
public class ChildLookupException extends ResourceGraphException {
	private static final long serialVersionUID = 1L;
	private final ObjectKey parent;
	/**
	 * Gets key of the object whose children could not be listed.
	 * 
	 * @return key of the parent object
	 */
	public ObjectKey parent() {
		return parent;
	}
	public ChildLookupException(ObjectKey parent, Throwable cause) {
		super("Failed to list children of " + parent + ".", cause);
		this.parent = parent;
	}
}
