// Part of Resourcegraph
package com.machinezoo.resourcegraph.view;

import java.util.*;
import com.google.common.collect.*;

/**
 * Type tag and title of a {@link Component}.
 */
public class ComponentMetadata {
	private final String type;
	public String type() {
		return type;
	}
	private final ImmutableList<Text> title;
	public List<Text> title() {
		return title;
	}
	public ComponentMetadata(String type, List<Text> title) {
		Objects.requireNonNull(type);
		this.type = type;
		this.title = ImmutableList.copyOf(title);
	}
	@Override public boolean equals(Object obj) {
		if (!(obj instanceof ComponentMetadata))
			return false;
		ComponentMetadata other = (ComponentMetadata)obj;
		return type.equals(other.type) && title.equals(other.title);
	}
	@Override public int hashCode() {
		return Objects.hash(type, title);
	}
	@Override public String toString() {
		return type + title;
	}
}
