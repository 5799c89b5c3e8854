package org.ihtsdo.termserver.tx.domain;

import org.ihtsdo.termserver.tx.context.Language;

public class Designation {

	private final boolean display;
	private final String status;
	private final Language language;
	private final Coding use;
	private final String value;

	public Designation(boolean display, String status, Language language, Coding use, String value) {
		this.display = display;
		this.status = status;
		this.language = language;
		this.use = use;
		this.value = value;
	}

	public boolean isDisplay() {
		return display;
	}

	public String getStatus() {
		return status;
	}

	public Language getLanguage() {
		return language;
	}

	public Coding getUse() {
		return use;
	}

	public String getValue() {
		return value;
	}

	public boolean isActive() {
		return !("withdrawn".equals(status) || "inactive".equals(status));
	}

	public boolean hasUse(Coding other) {
		return use != null && use.matches(other);
	}

	@Override
	public String toString() {
		String lang = language == null ? "" : language.getCode();
		return "[" + lang + "] " + (use == null ? "" : use.getCode() + ": ") + value;
	}
}
