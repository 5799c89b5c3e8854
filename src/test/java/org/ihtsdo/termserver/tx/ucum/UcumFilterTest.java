package org.ihtsdo.termserver.tx.ucum;

import static org.ihtsdo.termserver.tx.ucum.UcumTestSupport.failure;
import static org.junit.Assert.*;

import java.util.*;

import org.apache.commons.lang.NotImplementedException;
import org.ihtsdo.termserver.tx.FilterPreconditionException;
import org.ihtsdo.termserver.tx.InvalidConceptStateException;
import org.ihtsdo.termserver.tx.UnsupportedFilterException;
import org.ihtsdo.termserver.tx.context.OperationContext;
import org.ihtsdo.termserver.tx.provider.ConceptContext;
import org.ihtsdo.termserver.tx.provider.ConceptFilter;
import org.ihtsdo.termserver.tx.provider.FilterExecutionContext;
import org.ihtsdo.termserver.tx.provider.LocateResult;
import org.junit.Before;
import org.junit.Test;

public class UcumFilterTest {

	private UcumCodeSystemProvider provider;
	private UcumCodeSystemProvider bareProvider;

	@Before
	public void setup() throws Exception {
		StubUcumService ucumService = new StubUcumService();
		provider = new UcumCodeSystemFactory(ucumService, UcumTestSupport.testCommonUnits())
				.build(new OperationContext("en"), null);
		bareProvider = new UcumCodeSystemFactory(ucumService).build(new OperationContext("en"), null);
	}

	private ConceptFilter onlyFilter(UcumCodeSystemProvider p, FilterExecutionContext ctx) {
		List<ConceptFilter> filters = p.executeFilters(ctx).join();
		assertEquals(1, filters.size());
		return filters.get(0);
	}

	private List<String> iterate(UcumCodeSystemProvider p, FilterExecutionContext ctx, ConceptFilter filter) {
		List<String> codes = new ArrayList<>();
		while (p.filterMore(ctx, filter).join()) {
			codes.add(p.filterConcept(ctx, filter).join().getCode());
		}
		return codes;
	}

	@Test
	public void onlyCanonicalEqualsIsSupported() {
		assertTrue(provider.doesFilter("canonical", "=", "g"));
		assertFalse(provider.doesFilter("canonical", "in", "g"));
		assertFalse(provider.doesFilter("concept", "is-a", "g"));
	}

	@Test
	public void iterateCanonicalFilterInEnumerationOrder() {
		FilterExecutionContext ctx = provider.getPrepContext(true);
		provider.filter(ctx, "canonical", "=", "g").join();
		ConceptFilter filter = onlyFilter(provider, ctx);

		assertTrue(filter.isMaterialised());
		assertEquals(4, provider.filterSize(ctx, filter).join().intValue());
		assertEquals(Arrays.asList("g", "mg", "kg", "ug"), iterate(provider, ctx, filter));
		//Exhausted filters stay exhausted
		assertFalse(provider.filterMore(ctx, filter).join());
	}

	@Test
	public void canonicalWithNoMatchesIsEmpty() {
		FilterExecutionContext ctx = provider.getPrepContext(true);
		provider.filter(ctx, "canonical", "=", "mol").join();
		ConceptFilter filter = onlyFilter(provider, ctx);
		assertEquals(0, provider.filterSize(ctx, filter).join().intValue());
		assertFalse(provider.filterMore(ctx, filter).join());
	}

	@Test
	public void canonicalFilterNeedsAUnit() {
		for (String value : Arrays.asList("", "  ")) {
			FilterExecutionContext ctx = provider.getPrepContext(false);
			Throwable t = failure(provider.filter(ctx, "canonical", "=", value));
			assertTrue(t instanceof UnsupportedFilterException);
			assertEquals("A canonical filter needs a unit to compare with", t.getMessage());
			assertTrue(ctx.getFilters().isEmpty());
		}
	}

	@Test
	public void uncanonicalisableCommonUnitsNeverMatch() {
		FilterExecutionContext ctx = provider.getPrepContext(false);
		provider.filter(ctx, "canonical", "=", "g").join();
		ConceptFilter filter = onlyFilter(provider, ctx);
		//[pH] is a common unit, but has no canonical form to compare
		LocateResult result = provider.filterLocate(ctx, filter, "[pH]").join();
		assertFalse(result.isFound());
	}

	@Test
	public void filterConceptBeforeFilterMoreIsRejected() {
		FilterExecutionContext ctx = provider.getPrepContext(true);
		provider.filter(ctx, "canonical", "=", "g").join();
		ConceptFilter filter = onlyFilter(provider, ctx);
		assertTrue(failure(provider.filterConcept(ctx, filter)) instanceof IndexOutOfBoundsException);
	}

	@Test
	public void unsupportedPropertyOrOperator() {
		FilterExecutionContext ctx = provider.getPrepContext(false);
		Throwable t = failure(provider.filter(ctx, "concept", "=", "g"));
		assertTrue(t instanceof UnsupportedFilterException);
		assertEquals("concept", ((UnsupportedFilterException) t).getProperty());

		t = failure(provider.filter(ctx, "canonical", "regex", "g.*"));
		assertTrue(t instanceof UnsupportedFilterException);
		assertEquals("Unsupported filter operator for canonical: regex", t.getMessage());
		assertTrue(ctx.getFilters().isEmpty());
	}

	@Test
	public void iteratingWithoutCommonUnitsIsAPreconditionFailure() {
		FilterExecutionContext ctx = bareProvider.getPrepContext(true);
		Throwable t = failure(bareProvider.filter(ctx, "canonical", "=", "g"));
		assertTrue(t instanceof FilterPreconditionException);
		assertTrue(t.getMessage().contains("common units"));
	}

	@Test
	public void locatingWithoutCommonUnitsIsFine() {
		FilterExecutionContext ctx = bareProvider.getPrepContext(false);
		bareProvider.filter(ctx, "canonical", "=", "g").join();
		ConceptFilter filter = onlyFilter(bareProvider, ctx);
		assertFalse(filter.isMaterialised());
		assertTrue(bareProvider.filterLocate(ctx, filter, "ng").join().isFound());
		assertTrue(failure(bareProvider.filterSize(ctx, filter)) instanceof InvalidConceptStateException);
		assertTrue(failure(bareProvider.filterMore(ctx, filter)) instanceof InvalidConceptStateException);
	}

	@Test
	public void filterLocateMatchingCanonical() {
		FilterExecutionContext ctx = provider.getPrepContext(false);
		provider.filter(ctx, "canonical", "=", "g").join();
		ConceptFilter filter = onlyFilter(provider, ctx);

		for (String code : Arrays.asList("g", "kg", "mg", "ug", "ng")) {
			LocateResult result = provider.filterLocate(ctx, filter, code).join();
			assertTrue(code, result.isFound());
			assertEquals(code, result.getContext().getCode());
		}
	}

	@Test
	public void filterLocateMismatchNamesBothForms() {
		FilterExecutionContext ctx = provider.getPrepContext(false);
		provider.filter(ctx, "canonical", "=", "g").join();
		ConceptFilter filter = onlyFilter(provider, ctx);

		LocateResult result = provider.filterLocate(ctx, filter, "cm").join();
		assertFalse(result.isFound());
		assertEquals("Code cm has canonical form m, not g as required", result.getMessage());
	}

	@Test
	public void filterLocateInvalidOrUncanonicalisable() {
		FilterExecutionContext ctx = provider.getPrepContext(false);
		provider.filter(ctx, "canonical", "=", "g").join();
		ConceptFilter filter = onlyFilter(provider, ctx);

		LocateResult invalid = provider.filterLocate(ctx, filter, "kg.").join();
		assertFalse(invalid.isFound());
		assertTrue(invalid.getMessage().startsWith("Invalid UCUM code: Syntax error"));

		LocateResult special = provider.filterLocate(ctx, filter, "Cel").join();
		assertFalse(special.isFound());
		assertTrue(special.getMessage().startsWith("Error getting canonical form for Cel: "));
	}

	@Test
	public void filterLocateDoesNotMoveTheCursor() {
		FilterExecutionContext ctx = provider.getPrepContext(true);
		provider.filter(ctx, "canonical", "=", "g").join();
		UcumFilter filter = (UcumFilter) onlyFilter(provider, ctx);
		assertTrue(provider.filterMore(ctx, filter).join());
		provider.filterLocate(ctx, filter, "kg").join();
		assertEquals(0, filter.getCursor());
		assertEquals("g", provider.filterConcept(ctx, filter).join().getCode());
	}

	@Test
	public void filterCheck() {
		FilterExecutionContext ctx = provider.getPrepContext(false);
		provider.filter(ctx, "canonical", "=", "g").join();
		ConceptFilter filter = onlyFilter(provider, ctx);

		assertTrue(provider.filterCheck(ctx, filter, provider.locate("mg").join().getContext()).join());
		assertFalse(provider.filterCheck(ctx, filter, provider.locate("s").join().getContext()).join());
		assertFalse(provider.filterCheck(ctx, filter, provider.locate("[pH]").join().getContext()).join());
	}

	@Test
	public void specialFilterEnumeratesCommonUnits() {
		FilterExecutionContext ctx = provider.getPrepContext(true);
		provider.specialFilter(ctx, false).join();
		ConceptFilter filter = onlyFilter(provider, ctx);

		assertEquals(7, provider.filterSize(ctx, filter).join().intValue());
		assertEquals(Arrays.asList("g", "mg", "m", "kg", "[pH]", "mg/dL", "ug"), iterate(provider, ctx, filter));

		assertTrue(provider.filterLocate(ctx, filter, "[pH]").join().isFound());
		LocateResult notCommon = provider.filterLocate(ctx, filter, "cm").join();
		assertEquals("Code cm is not in the common units enumeration", notCommon.getMessage());

		ConceptContext cm = provider.locate("cm").join().getContext();
		assertFalse(provider.filterCheck(ctx, filter, cm).join());
	}

	@Test
	public void specialFilterWithoutCommonUnitsAcceptsAnyValidCode() {
		FilterExecutionContext ctx = bareProvider.getPrepContext(false);
		bareProvider.specialFilter(ctx, false).join();
		ConceptFilter filter = onlyFilter(bareProvider, ctx);
		assertTrue(bareProvider.filterLocate(ctx, filter, "cm").join().isFound());
		assertFalse(bareProvider.filterLocate(ctx, filter, "furlong").join().isFound());
		assertTrue(bareProvider.filterCheck(ctx, filter, bareProvider.locate("s").join().getContext()).join());

		assertTrue(failure(bareProvider.specialFilter(bareProvider.getPrepContext(true), false)) instanceof FilterPreconditionException);
	}

	@Test
	public void multipleFiltersAreReturnedUnchanged() {
		FilterExecutionContext ctx = provider.getPrepContext(true);
		provider.filter(ctx, "canonical", "=", "g").join();
		provider.filter(ctx, "canonical", "=", "m").join();
		List<ConceptFilter> filters = provider.executeFilters(ctx).join();
		assertEquals(ctx.getFilters(), filters);
		assertEquals(2, filters.size());
		assertEquals(Collections.singletonList("m"), iterate(provider, ctx, filters.get(1)));
		//Each filter has its own cursor
		assertEquals(Arrays.asList("g", "mg", "kg", "ug"), iterate(provider, ctx, filters.get(0)));
	}

	@Test
	public void filtersAreNeverClosed() {
		FilterExecutionContext ctx = provider.getPrepContext(true);
		provider.filter(ctx, "canonical", "=", "g").join();
		assertTrue(provider.filtersNotClosed(ctx).join());
		provider.filterFinish(ctx);
		assertTrue(ctx.getFilters().isEmpty());
	}

	@Test
	public void textSearchIsNotSupported() {
		assertTrue(failure(provider.searchFilter(provider.getPrepContext(true), "gram", true)) instanceof NotImplementedException);
	}
}
