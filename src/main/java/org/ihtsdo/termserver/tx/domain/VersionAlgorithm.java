package org.ihtsdo.termserver.tx.domain;

/**
 * How versions of a code system are ordered when comparing them.
 */
public enum VersionAlgorithm {
	SEMVER("semver"),
	INTEGER("integer"),
	ALPHA("alpha"),
	DATE("date"),
	NATURAL("natural");

	private final String code;

	VersionAlgorithm(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}
}
