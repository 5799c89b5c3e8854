package org.ihtsdo.termserver.tx;

public class CircularReferenceException extends TerminologyException {

	private static final long serialVersionUID = 1L;

	public CircularReferenceException(String msg) {
		super(msg);
	}
}
