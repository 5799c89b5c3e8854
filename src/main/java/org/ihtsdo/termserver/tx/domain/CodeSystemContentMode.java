package org.ihtsdo.termserver.tx.domain;

public enum CodeSystemContentMode {
	COMPLETE("complete"),
	EXAMPLE("example"),
	FRAGMENT("fragment"),
	NOT_PRESENT("not-present"),
	SUPPLEMENT("supplement");

	private final String code;

	CodeSystemContentMode(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}
}
