// Part of Resourcegraph
package com.machinezoo.resourcegraph;

/**
 * Thrown from constructors when a required collaborator is missing.
 */
public class ConfigurationException extends ResourceGraphException {
	private static final long serialVersionUID = 1L;
	public ConfigurationException(String message) {
		super(message);
	}
}
