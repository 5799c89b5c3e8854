package org.ihtsdo.termserver.tx.domain;

/**
 * Well known designation uses.
 */
public final class DesignationUse {

	public static final String HL7_TERM_MAINT_INFRA = "http://terminology.hl7.org/CodeSystem/hl7TermMaintInfra";
	public static final String SCT = "http://snomed.info/sct";

	public static final Coding DISPLAY = new Coding(HL7_TERM_MAINT_INFRA, "preferredForLanguage");
	public static final Coding FSN = new Coding(SCT, "900000000000003001");
	public static final Coding PREFERRED = new Coding(SCT, "900000000000548007");
	public static final Coding SYNONYM = new Coding(SCT, "900000000000013009");

	private DesignationUse() {
	}

	/**
	 * A designation without a use is treated as a display.
	 */
	public static boolean isDisplay(Coding use) {
		return use == null || (use.matches(DISPLAY) || use.matches(FSN) || use.matches(PREFERRED));
	}

	public static Coding copyOf(Coding use) {
		return new Coding(use.getSystem(), use.getCode());
	}
}
