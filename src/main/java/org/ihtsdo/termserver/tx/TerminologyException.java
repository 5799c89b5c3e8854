package org.ihtsdo.termserver.tx;

public class TerminologyException extends Exception {

	private static final long serialVersionUID = 1L;

	public TerminologyException(String msg, Throwable t) {
		super(msg, t);
	}

	public TerminologyException(String msg) {
		super(msg);
	}
}
