package org.ihtsdo.termserver.tx;

/**
 * Thrown when a provider is asked to filter on a property/operator pair it does not implement.
 * This is a caller or configuration defect rather than bad user input.
 */
public class UnsupportedFilterException extends TerminologyException {

	private static final long serialVersionUID = 1L;

	private final String property;
	private final String operator;

	public UnsupportedFilterException(String property, String operator, String msg) {
		super(msg);
		this.property = property;
		this.operator = operator;
	}

	public String getProperty() {
		return property;
	}

	public String getOperator() {
		return operator;
	}
}
