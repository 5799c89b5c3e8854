package org.ihtsdo.termserver.tx;

public class FilterPreconditionException extends TerminologyException {

	private static final long serialVersionUID = 1L;

	public FilterPreconditionException(String msg) {
		super(msg);
	}
}
