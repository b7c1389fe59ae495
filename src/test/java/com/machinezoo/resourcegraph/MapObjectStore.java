// Part of Resourcegraph
package com.machinezoo.resourcegraph;

import java.util.*;
import java.util.concurrent.*;
import com.machinezoo.resourcegraph.objects.*;

public class MapObjectStore implements ObjectStore {
	private final Map<ObjectKey, ClusterObject> objects = new ConcurrentSkipListMap<>();
	public MapObjectStore add(ClusterObject... added) {
		for (ClusterObject object : added)
			objects.put(ObjectKey.of(object), object);
		return this;
	}
	@Override
	public List<ClusterObject> list(TraversalContext context, String namespace) {
		context.check();
		List<ClusterObject> listed = new ArrayList<>();
		for (ClusterObject object : objects.values())
			if (object.metadata().namespace().equals(namespace))
				listed.add(object);
		return listed;
	}
}
