// Part of Resourcegraph
package com.machinezoo.resourcegraph.objects;

import com.machinezoo.resourcegraph.*;

/**
 * Thrown when an object lacks the identity metadata needed to derive its {@link ObjectKey}.
 */
public class InvalidObjectException extends ResourceGraphException {
	private static final long serialVersionUID = 1L;
	public InvalidObjectException(String message) {
		super(message);
	}
}
