package org.ihtsdo.termserver.tx;

public class TooCostlyException extends TerminologyException {

	private static final long serialVersionUID = 1L;

	private final String diagnostics;

	public TooCostlyException(String msg, String diagnostics) {
		super(msg);
		this.diagnostics = diagnostics;
	}

	public String getDiagnostics() {
		return diagnostics;
	}
}
