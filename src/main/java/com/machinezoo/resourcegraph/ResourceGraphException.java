// Part of Resourcegraph
package com.machinezoo.resourcegraph;

/**
 * Base class of all exceptions thrown by graph building and caching.
 */
public class ResourceGraphException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	public ResourceGraphException(String message) {
		super(message);
	}
	public ResourceGraphException(String message, Throwable cause) {
		super(message, cause);
	}
}
