package org.ihtsdo.termserver.tx;

/**
 * Internal contract violation, eg a context from another provider, or a code that
 * could not be resolved where a valid concept was assumed.
 */
public class InvalidConceptStateException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	public InvalidConceptStateException(String msg) {
		super(msg);
	}

	public InvalidConceptStateException(String msg, Throwable t) {
		super(msg, t);
	}
}
