package org.ihtsdo.termserver.tx.domain;

public class Feature {

	private final String feature;
	private final String value;

	public Feature(String feature, String value) {
		this.feature = feature;
		this.value = value;
	}

	public String getFeature() {
		return feature;
	}

	public String getValue() {
		return value;
	}

	@Override
	public String toString() {
		return feature + "=" + value;
	}
}
