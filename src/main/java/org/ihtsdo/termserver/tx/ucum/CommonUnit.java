package org.ihtsdo.termserver.tx.ucum;

import java.util.Objects;

/**
 * An entry from the common units value set.  The canonical form is null when the grammar
 * engine could not compute one.
 */
public final class CommonUnit {

	private final String code;
	private final String display;
	private final String canonical;

	public CommonUnit(String code, String display, String canonical) {
		this.code = Objects.requireNonNull(code, "code");
		this.display = display;
		this.canonical = canonical;
	}

	public String getCode() {
		return code;
	}

	public String getDisplay() {
		return display;
	}

	public String getCanonical() {
		return canonical;
	}

	public boolean hasCanonical() {
		return canonical != null;
	}

	@Override
	public String toString() {
		return code + (display == null ? "" : " \"" + display + "\"") + (canonical == null ? "" : " [" + canonical + "]");
	}
}
