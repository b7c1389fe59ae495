// Part of Resourcegraph
package com.machinezoo.resourcegraph.objects;

import java.util.*;

/**
 * Link from an object to the object that owns it.
 * Owner references are how controllers (deployments, replica sets, jobs) claim the objects they create.
 */
public class OwnerReference {
	private final String apiVersion;
	public String apiVersion() {
		return apiVersion;
	}
	private final String kind;
	public String kind() {
		return kind;
	}
	private final String name;
	public String name() {
		return name;
	}
	private final String uid;
	public String uid() {
		return uid;
	}
	private final boolean controller;
	public boolean controller() {
		return controller;
	}
	public OwnerReference(String apiVersion, String kind, String name, String uid, boolean controller) {
		Objects.requireNonNull(uid);
		this.apiVersion = apiVersion != null ? apiVersion : "";
		this.kind = kind != null ? kind : "";
		this.name = name != null ? name : "";
		this.uid = uid;
		this.controller = controller;
	}
	/**
	 * Creates controller reference pointing to the given owner.
	 * 
	 * @param owner
	 *            object that should own the referencing object, must have uid
	 * @return new controller reference
	 */
	public static OwnerReference controller(ClusterObject owner) {
		return new OwnerReference(owner.apiVersion(), owner.kind(), owner.metadata().name(), owner.metadata().uid(), true);
	}
	@Override public boolean equals(Object obj) {
		if (!(obj instanceof OwnerReference))
			return false;
		OwnerReference other = (OwnerReference)obj;
		return apiVersion.equals(other.apiVersion)
			&& kind.equals(other.kind)
			&& name.equals(other.name)
			&& uid.equals(other.uid)
			&& controller == other.controller;
	}
	@Override public int hashCode() {
		return Objects.hash(apiVersion, kind, name, uid, controller);
	}
	@Override public String toString() {
		return kind + "/" + name + " (" + uid + ")";
	}
}
