package org.ihtsdo.termserver.tx.provider;

/**
 * Outcome of looking for a code: either a context, or a message saying why there isn't one.
 */
public class LocateResult {

	private final ConceptContext context;
	private final String message;

	private LocateResult(ConceptContext context, String message) {
		this.context = context;
		this.message = message;
	}

	public static LocateResult found(ConceptContext context) {
		if (context == null) {
			throw new IllegalArgumentException("A located result needs a context");
		}
		return new LocateResult(context, null);
	}

	public static LocateResult notFound(String message) {
		return new LocateResult(null, message);
	}

	public ConceptContext getContext() {
		return context;
	}

	public String getMessage() {
		return message;
	}

	public boolean isFound() {
		return context != null;
	}

	@Override
	public String toString() {
		return isFound() ? "found: " + context : "not found: " + message;
	}
}
