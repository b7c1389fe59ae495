// Part of Resourcegraph
package com.machinezoo.resourcegraph.view;

/**
 * Renderable artifact consumed by the UI layer.
 */
public interface Component {
	ComponentMetadata metadata();
	/**
	 * Checks whether there is anything to render.
	 * 
	 * @return {@code true} if the component has no content
	 */
	boolean empty();
}
