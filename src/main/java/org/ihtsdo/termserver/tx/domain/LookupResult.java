package org.ihtsdo.termserver.tx.domain;

import java.util.*;

/**
 * Properties added to a $lookup response, in the order they were added.
 */
public class LookupResult {

	private final List<Map.Entry<String, String>> properties = new ArrayList<>();

	public void addProperty(String name, String value) {
		properties.add(new AbstractMap.SimpleImmutableEntry<>(name, value));
	}

	public List<Map.Entry<String, String>> getProperties() {
		return Collections.unmodifiableList(properties);
	}

	public String getProperty(String name) {
		for (Map.Entry<String, String> entry : properties) {
			if (entry.getKey().equals(name)) {
				return entry.getValue();
			}
		}
		return null;
	}

	public boolean hasProperty(String name) {
		return getProperty(name) != null;
	}
}
