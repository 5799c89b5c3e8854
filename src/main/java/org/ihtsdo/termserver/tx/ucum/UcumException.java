package org.ihtsdo.termserver.tx.ucum;

public class UcumException extends Exception {

	private static final long serialVersionUID = 1L;

	public UcumException(String msg) {
		super(msg);
	}

	public UcumException(String msg, Throwable t) {
		super(msg, t);
	}
}
