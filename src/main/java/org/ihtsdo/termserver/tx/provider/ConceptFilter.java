package org.ihtsdo.termserver.tx.provider;

/**
 * State of one filter within a {@link FilterExecutionContext}.  Providers define what it holds;
 * an iterating filter carries its own cursor so it must not be shared between requests.
 */
public interface ConceptFilter {

	/**
	 * @return true if the filter's members have been computed and can be iterated and counted
	 */
	boolean isMaterialised();
}
