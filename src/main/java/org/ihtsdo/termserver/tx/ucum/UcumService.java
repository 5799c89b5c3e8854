package org.ihtsdo.termserver.tx.ucum;

/**
 * The UCUM grammar engine: parses, validates and canonicalises unit expressions.
 * Implementations are expected to be thread safe and to always terminate.
 */
public interface UcumService {

	/**
	 * @return null if the unit is valid, otherwise a message describing the problem
	 */
	String validate(String unit);

	/**
	 * @return a human readable description of the unit expression, eg "(milli)gram"
	 */
	String analyse(String unit);

	/**
	 * @return the unit expressed in canonical (base) units
	 * @throws UcumException if the unit can't be parsed or canonicalised
	 */
	String getCanonicalUnits(String unit) throws UcumException;

	UcumVersionDetails ucumIdentification();
}
