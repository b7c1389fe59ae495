// Part of Resourcegraph
package com.machinezoo.resourcegraph;

import java.util.concurrent.*;

/*
 * Extends the JDK's CancellationException, so that code consuming resolution futures
 * sees the same exception type it would see after CompletableFuture.cancel().
 */
/**
 * Thrown when traversal observes cancellation or an expired deadline in its {@link TraversalContext}.
 */
public class TraversalCancelledException extends CancellationException {
	private static final long serialVersionUID = 1L;
	public TraversalCancelledException(String message) {
		super(message);
	}
}
