// Part of Resourcegraph
package com.machinezoo.resourcegraph;

import java.time.*;
import java.util.*;
import com.machinezoo.resourcegraph.util.*;

/*
 * Cancellation signal threaded through every collaborator call made during traversal.
 * Contexts form a tree. Cancelling a context cancels all contexts derived from it, but not its parent.
 * Deadlines are inherited the same way, i.e. the effective deadline is the earliest one on the path to the root.
 * 
 * Contexts are polled. Nothing is interrupted. Collaborators that block for a long time
 * should call check() periodically or pass remaining() to their own timeouts.
 */
/**
 * Cancellation and deadline signal for graph traversals.
 * Obtain a root context from {@link #background()} and derive child contexts from it.
 */
public class TraversalContext {
	private static final TraversalContext background = new TraversalContext(null, null);
	/**
	 * Gets root context that is never cancelled and has no deadline.
	 * 
	 * @return shared background context
	 */
	public static TraversalContext background() {
		return background;
	}
	private final TraversalContext parent;
	private final Instant deadline;
	private volatile String reason;
	private TraversalContext(TraversalContext parent, Instant deadline) {
		this.parent = parent;
		this.deadline = deadline;
		OwnerTrace.of(this).alias("context");
		if (parent != null)
			OwnerTrace.of(this).parent(parent);
		if (deadline != null)
			OwnerTrace.of(this).tag("deadline", deadline);
	}
	public TraversalContext withCancel() {
		return new TraversalContext(this, null);
	}
	public TraversalContext withDeadline(Instant deadline) {
		Objects.requireNonNull(deadline);
		return new TraversalContext(this, deadline);
	}
	public TraversalContext withTimeout(Duration timeout) {
		Objects.requireNonNull(timeout);
		return withDeadline(Instant.now().plus(timeout));
	}
	/**
	 * Cancels this context and all contexts derived from it.
	 * Background context cannot be cancelled.
	 * 
	 * @throws IllegalStateException
	 *             if this is the {@link #background()} context
	 */
	public void cancel() {
		if (this == background)
			throw new IllegalStateException("Background context cannot be cancelled.");
		if (reason == null)
			reason = "Traversal was cancelled.";
	}
	public Optional<Instant> deadline() {
		Instant earliest = null;
		for (TraversalContext context = this; context != null; context = context.parent)
			if (context.deadline != null && (earliest == null || context.deadline.isBefore(earliest)))
				earliest = context.deadline;
		return Optional.ofNullable(earliest);
	}
	public Optional<Duration> remaining() {
		return deadline().map(d -> Duration.between(Instant.now(), d));
	}
	private String cause() {
		for (TraversalContext context = this; context != null; context = context.parent) {
			if (context.reason != null)
				return context.reason;
			if (context.deadline != null && !Instant.now().isBefore(context.deadline))
				return "Traversal deadline exceeded.";
		}
		return null;
	}
	public boolean cancelled() {
		return cause() != null;
	}
	/**
	 * Throws if this context is cancelled or its deadline has passed.
	 * 
	 * @throws TraversalCancelledException
	 *             if the context is no longer active
	 */
	public void check() {
		String cause = cause();
		if (cause != null)
			throw new TraversalCancelledException(cause);
	}
	@Override public String toString() {
		return OwnerTrace.of(this) + (cancelled() ? " (cancelled)" : "");
	}
}
