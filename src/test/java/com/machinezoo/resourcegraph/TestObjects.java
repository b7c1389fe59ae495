// Part of Resourcegraph
package com.machinezoo.resourcegraph;

import java.util.*;
import com.machinezoo.resourcegraph.objects.*;

public class TestObjects {
	public static GenericObject deployment() {
		return new GenericObject("apps/v1", "Deployment", new ObjectMetadata("deployment", "").withUid("deployment"));
	}
	public static GenericObject object(String kind, String name) {
		return new GenericObject("v1", kind, new ObjectMetadata(name, "default").withUid(name));
	}
	public static GenericObject owned(String kind, String name, ClusterObject owner) {
		ObjectMetadata metadata = new ObjectMetadata(name, owner.metadata().namespace())
			.withUid(name)
			.withOwners(List.of(OwnerReference.controller(owner)));
		return new GenericObject("v1", kind, metadata);
	}
}
