// Part of Resourcegraph
package com.machinezoo.resourcegraph.visitor;

import java.util.*;
import org.slf4j.*;
import com.machinezoo.resourcegraph.*;
import com.machinezoo.resourcegraph.objects.*;
import com.machinezoo.resourcegraph.util.*;

/*
 * Traversal is iterative depth-first search with explicit stack, so that long owner chains cannot overflow the thread stack.
 * Children are pushed in reverse, which makes the visiting order equal to preorder in queryer's order.
 * 
 * Every object is expanded at most once per visit() call. Objects reached again through another path
 * only get the new edge. This handles diamonds and cycles alike.
 * 
 * Queryer failures are contained to the branch that failed. Other branches are still traversed,
 * because partial graph is more useful for diagnostics than no graph. The first failure is thrown
 * after traversal ends with later failures attached as suppressed exceptions.
 * Cancellation is the exception to this rule. It stops traversal immediately.
 */
/**
 * Default {@link Visitor} that records every reachable object in {@link ObjectGraph}.
 */
public class GraphVisitor implements Visitor {
	private static final Logger logger = LoggerFactory.getLogger(GraphVisitor.class);
	private final ViewerConfig config;
	private final Queryer queryer;
	private final ObjectGraph graph;
	public ObjectGraph graph() {
		return graph;
	}
	public GraphVisitor(ViewerConfig config, Queryer queryer, ObjectGraph graph) {
		Objects.requireNonNull(config);
		Objects.requireNonNull(queryer);
		Objects.requireNonNull(graph);
		this.config = config;
		this.queryer = queryer;
		this.graph = graph;
		OwnerTrace.of(this)
			.alias("visitor")
			.parent(graph);
	}
	private static class Step {
		final NodeKey parent;
		final ClusterObject object;
		Step(NodeKey parent, ClusterObject object) {
			this.parent = parent;
			this.object = object;
		}
	}
	@Override
	public void visit(TraversalContext context, ClusterObject object) {
		Objects.requireNonNull(context);
		ObjectKey rootKey = ObjectKey.of(object);
		context.check();
		NodeKey root = graph.resolve(object, path(context, object));
		Set<ObjectKey> visited = new HashSet<>();
		visited.add(rootKey);
		List<RuntimeException> failures = new ArrayList<>();
		Deque<Step> stack = new ArrayDeque<>();
		expand(context, root, rootKey, object, stack, failures);
		while (!stack.isEmpty()) {
			Step step = stack.pop();
			ObjectKey key;
			NodeKey node;
			try {
				key = ObjectKey.of(step.object);
				node = NodeKey.of(step.object);
			} catch (InvalidObjectException ex) {
				failures.add(ex);
				continue;
			}
			graph.add(step.object);
			graph.link(step.parent, node);
			if (visited.add(key))
				expand(context, node, key, step.object, stack, failures);
		}
		if (!failures.isEmpty()) {
			RuntimeException first = failures.get(0);
			for (RuntimeException other : failures.subList(1, failures.size()))
				first.addSuppressed(other);
			throw first;
		}
	}
	private String path(TraversalContext context, ClusterObject object) {
		try {
			return config.objectPath(context, object.apiVersion(), object.kind(), object.metadata().name());
		} catch (TraversalCancelledException | ResourceGraphException ex) {
			throw ex;
		} catch (RuntimeException ex) {
			throw new ResourceGraphException("Failed to compute path of " + ObjectKey.of(object) + ".", ex);
		}
	}
	private void expand(TraversalContext context, NodeKey node, ObjectKey key, ClusterObject object, Deque<Step> stack, List<RuntimeException> failures) {
		context.check();
		List<ClusterObject> children;
		try {
			children = queryer.children(context, object);
		} catch (TraversalCancelledException ex) {
			throw ex;
		} catch (RuntimeException ex) {
			logger.debug("Failed to list children of {}.", key, ex);
			failures.add(new ChildLookupException(key, ex));
			return;
		}
		if (children == null)
			return;
		for (int i = children.size() - 1; i >= 0; --i)
			stack.push(new Step(node, children.get(i)));
	}
	@Override public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
