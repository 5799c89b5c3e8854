package org.ihtsdo.termserver.tx.provider;

/**
 * Handle to a code that a provider has located or validated.  Each provider has its own
 * implementation and only accepts its own handles back.  Implementations are immutable.
 */
public interface ConceptContext {

	String getCode();
}
