package org.ihtsdo.termserver.tx.domain;

public enum SubsumptionOutcome {
	EQUIVALENT("equivalent"),
	SUBSUMES("subsumes"),
	SUBSUMED_BY("subsumed-by"),
	NOT_SUBSUMED("not-subsumed");

	private final String code;

	SubsumptionOutcome(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}
}
