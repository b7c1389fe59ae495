// Part of Resourcegraph
package com.machinezoo.resourcegraph.view;

import java.util.*;
import com.google.common.collect.*;

/**
 * Plain text component, used mostly in titles.
 */
public class Text implements Component {
	public static final String TYPE = "text";
	private final String text;
	public String text() {
		return text;
	}
	public Text(String text) {
		Objects.requireNonNull(text);
		this.text = text;
	}
	@Override
	public ComponentMetadata metadata() {
		return new ComponentMetadata(TYPE, ImmutableList.of());
	}
	@Override
	public boolean empty() {
		return text.isEmpty();
	}
	@Override public boolean equals(Object obj) {
		return obj instanceof Text && text.equals(((Text)obj).text);
	}
	@Override public int hashCode() {
		return text.hashCode();
	}
	@Override public String toString() {
		return text;
	}
}
