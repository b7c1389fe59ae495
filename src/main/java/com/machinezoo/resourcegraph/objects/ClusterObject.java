// Part of Resourcegraph
package com.machinezoo.resourcegraph.objects;

/*
 * Every object kind exposes the same small capability set. Graph building never inspects concrete types.
 * Children are not part of this interface. They are discovered by Queryer, because relationships
 * are a property of the cluster, not of the object itself.
 */
/**
 * Object stored in the cluster, identified by its type and metadata.
 * 
 * @see ObjectKey#of(ClusterObject)
 * @see GenericObject
 */
public interface ClusterObject {
	/**
	 * Gets API group and version, for example {@code apps/v1}.
	 * 
	 * @return API group and version, possibly empty
	 */
	String apiVersion();
	String kind();
	ObjectMetadata metadata();
}
