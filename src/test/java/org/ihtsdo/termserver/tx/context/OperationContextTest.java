package org.ihtsdo.termserver.tx.context;

import static org.junit.Assert.*;

import org.ihtsdo.termserver.tx.CircularReferenceException;
import org.ihtsdo.termserver.tx.TooCostlyException;
import org.junit.Test;

public class OperationContextTest {

	@Test
	public void generatesAnIdWhenNoneGiven() {
		OperationContext first = new OperationContext("en");
		OperationContext second = new OperationContext("en");
		assertTrue(first.getId().startsWith("op_"));
		assertNotEquals(first.getId(), second.getId());
		assertEquals("req-1", new OperationContext(Languages.none(), "req-1", 10).getId());
	}

	@Test(expected = IllegalArgumentException.class)
	public void languagesAreRequired() {
		new OperationContext((Languages) null);
	}

	@Test(expected = CircularReferenceException.class)
	public void seeingAValueSetTwiceIsCircular() throws CircularReferenceException {
		OperationContext opContext = new OperationContext("en");
		opContext.seeContext("http://example.org/vs/a|1.0");
		opContext.seeContext("http://example.org/vs/b|1.0");
		opContext.seeContext("http://example.org/vs/a|1.0");
	}

	@Test
	public void clearedContextsCanBeSeenAgain() throws CircularReferenceException {
		OperationContext opContext = new OperationContext("en");
		opContext.seeContext("http://example.org/vs/a");
		opContext.clearContexts();
		opContext.seeContext("http://example.org/vs/a");
	}

	@Test
	public void withinTimeLimit() throws TooCostlyException {
		new OperationContext(Languages.none(), null, 30).deadCheck("start");
	}

	@Test
	public void overTimeLimitIsTooCostly() throws InterruptedException {
		OperationContext opContext = new OperationContext(Languages.none(), null, 0);
		Thread.sleep(5);
		try {
			opContext.deadCheck("expand");
			fail("Expected the time limit to be exceeded");
		} catch (TooCostlyException e) {
			assertTrue(e.getMessage().contains("expand"));
			assertTrue(e.getDiagnostics().contains("Operation took too long @ expand"));
		}
	}

	@Test
	public void copyIsIndependent() throws CircularReferenceException {
		OperationContext original = new OperationContext("fr");
		original.seeContext("http://example.org/vs/a");
		OperationContext copy = original.copy();
		assertEquals(original.getId(), copy.getId());
		assertSame(original.getLangs(), copy.getLangs());

		copy.seeContext("http://example.org/vs/b");
		copy.log("copy only");
		original.seeContext("http://example.org/vs/b");
		assertFalse(original.getLogEntries().stream().anyMatch(e -> e.endsWith("copy only")));
		assertTrue(copy.getLogEntries().stream().anyMatch(e -> e.endsWith("copy only")));
	}

	@Test
	public void logEntriesAreReadOnly() {
		OperationContext opContext = new OperationContext("en");
		opContext.log("hello");
		assertEquals(2, opContext.getLogEntries().size());
		assertTrue(opContext.diagnostics().endsWith("ms hello"));
		try {
			opContext.getLogEntries().add("x");
			fail("Expected an unmodifiable list");
		} catch (UnsupportedOperationException e) {
			assertEquals(2, opContext.getLogEntries().size());
		}
	}
}
