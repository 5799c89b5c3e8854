package org.ihtsdo.termserver.tx.util;

import static org.junit.Assert.*;

import org.junit.Test;

public class VersionUtilsTest {

	@Test
	public void semVer() {
		assertTrue(VersionUtils.isSemVer("1.2.3"));
		assertTrue(VersionUtils.isSemVer("2.1"));
		assertTrue(VersionUtils.isSemVer("1.0.0-ballot+build.7"));
		assertFalse(VersionUtils.isSemVer("01.2.3"));
		assertFalse(VersionUtils.isSemVer("20240131"));
		assertFalse(VersionUtils.isSemVer("http://snomed.info/sct/900000000000207008/version/20240131"));
		assertFalse(VersionUtils.isSemVer(""));
		assertFalse(VersionUtils.isSemVer(null));
	}

	@Test
	public void majorMinor() {
		assertEquals("1.2", VersionUtils.getMajMin("1.2.3"));
		assertEquals("4.0", VersionUtils.getMajMin("4.0.1-draft"));
		assertEquals("2.1", VersionUtils.getMajMin("2.1"));
		assertNull(VersionUtils.getMajMin("R4"));
	}
}
