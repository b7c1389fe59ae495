// Part of Resourcegraph
package com.machinezoo.resourcegraph.visitor;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.hamcrest.*;
import org.junit.jupiter.api.*;
import com.machinezoo.resourcegraph.*;
import com.machinezoo.resourcegraph.objects.*;

public class OwnerQueryerTest {
	@Test
	public void owners() {
		GenericObject deployment = TestObjects.object("Deployment", "web");
		GenericObject rs = TestObjects.owned("ReplicaSet", "web-1", deployment);
		GenericObject pod1 = TestObjects.owned("Pod", "web-1-a", rs);
		GenericObject pod2 = TestObjects.owned("Pod", "web-1-b", rs);
		GenericObject stray = TestObjects.object("Pod", "stray");
		GenericObject elsewhere = new GenericObject("v1", "Pod", new ObjectMetadata("remote", "other")
			.withUid("remote")
			.withOwners(List.of(OwnerReference.controller(rs))));
		MapObjectStore store = new MapObjectStore().add(deployment, rs, pod1, pod2, stray, elsewhere);
		OwnerQueryer queryer = new OwnerQueryer(store);
		TraversalContext context = TraversalContext.background();
		// Children are objects in the same namespace that reference the parent.
		assertEquals(List.of(rs), queryer.children(context, deployment));
		assertThat(queryer.children(context, rs), Matchers.<ClusterObject>containsInAnyOrder(pod1, pod2));
		assertThat(queryer.children(context, pod1), empty());
		// Objects without uid cannot own anything.
		GenericObject anonymous = new GenericObject("v1", "Pod", new ObjectMetadata("anonymous", "default"));
		assertThat(queryer.children(context, anonymous), empty());
	}
	@Test
	public void graph() {
		GenericObject deployment = TestObjects.object("Deployment", "web");
		GenericObject rs = TestObjects.owned("ReplicaSet", "web-1", deployment);
		GenericObject pod = TestObjects.owned("Pod", "web-1-a", rs);
		MapObjectStore store = new MapObjectStore().add(deployment, rs, pod);
		ResourceViewer viewer = new ResourceViewer(new FakeViewerConfig(store), new OwnerQueryer(store));
		// Owner references drive full traversal.
		assertThat(viewer.visit(TraversalContext.background(), deployment).nodes().keySet(), contains("web", "web-1", "web-1-a"));
	}
}
