// Part of Resourcegraph
package com.machinezoo.resourcegraph.visitor;

import java.util.*;
import com.machinezoo.resourcegraph.*;
import com.machinezoo.resourcegraph.objects.*;

/*
 * Controllers record ownership in owner references of the objects they create.
 * Deployment owns replica sets, which own pods. Children are therefore found by scanning
 * the parent's namespace for objects that reference the parent's uid.
 * Objects without uid cannot be referenced and have no children.
 */
/**
 * {@link Queryer} that discovers children through owner references of objects in {@link ObjectStore}.
 */
public class OwnerQueryer implements Queryer {
	private final ObjectStore store;
	public OwnerQueryer(ObjectStore store) {
		Objects.requireNonNull(store);
		this.store = store;
	}
	@Override
	public List<ClusterObject> children(TraversalContext context, ClusterObject object) {
		Objects.requireNonNull(context);
		String uid = object.metadata().uid();
		if (uid.isEmpty())
			return Collections.emptyList();
		List<ClusterObject> children = new ArrayList<>();
		for (ClusterObject candidate : store.list(context, object.metadata().namespace())) {
			if (candidate.metadata().ownedBy(uid) && !uid.equals(candidate.metadata().uid()))
				children.add(candidate);
		}
		return children;
	}
}
