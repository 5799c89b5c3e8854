package org.ihtsdo.termserver.tx.ucum;

import java.util.Objects;

import org.ihtsdo.termserver.tx.provider.ConceptContext;

/**
 * A unit expression that the grammar has accepted.  Holds the code exactly as supplied;
 * no canonicalisation is applied.
 */
public final class UcumContext implements ConceptContext {

	private final String code;

	public UcumContext(String code) {
		this.code = Objects.requireNonNull(code, "code");
	}

	@Override
	public String getCode() {
		return code;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof UcumContext && code.equals(((UcumContext) o).code);
	}

	@Override
	public int hashCode() {
		return code.hashCode();
	}

	@Override
	public String toString() {
		return code;
	}
}
