package org.ihtsdo.termserver.tx.ucum;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.apache.commons.lang.NotImplementedException;
import org.apache.commons.lang.StringUtils;
import org.ihtsdo.termserver.tx.FilterPreconditionException;
import org.ihtsdo.termserver.tx.InvalidConceptStateException;
import org.ihtsdo.termserver.tx.UnsupportedFilterException;
import org.ihtsdo.termserver.tx.context.Languages;
import org.ihtsdo.termserver.tx.context.OperationContext;
import org.ihtsdo.termserver.tx.domain.*;
import org.ihtsdo.termserver.tx.provider.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Provider for UCUM unit expressions.  The code space is infinite, so locating a code
 * means asking the grammar engine to validate it, and filters can only be iterated over
 * the common units value set when one is available.
 */
public class UcumCodeSystemProvider extends CodeSystemProvider {

	private static final Logger LOGGER = LoggerFactory.getLogger(UcumCodeSystemProvider.class);

	public static final String SYSTEM = "http://unitsofmeasure.org";
	public static final String CANONICAL = "canonical";
	public static final String EQUALS = "=";

	private final UcumService ucumService;
	private final CommonUnits commonUnits;

	public UcumCodeSystemProvider(OperationContext opContext, List<CodeSystemSupplement> supplements,
			UcumService ucumService, CommonUnits commonUnits, Executor executor) {
		super(opContext, supplements, executor);
		this.ucumService = Preconditions.checkNotNull(ucumService, "ucumService is required");
		this.commonUnits = commonUnits;
	}

	public UcumCodeSystemProvider(OperationContext opContext, List<CodeSystemSupplement> supplements,
			UcumService ucumService, CommonUnits commonUnits) {
		super(opContext, supplements);
		this.ucumService = Preconditions.checkNotNull(ucumService, "ucumService is required");
		this.commonUnits = commonUnits;
	}

	public CommonUnits getCommonUnits() {
		return commonUnits;
	}

	@Override
	public String system() {
		return SYSTEM;
	}

	@Override
	public String version() {
		return ucumService.ucumIdentification().getVersion();
	}

	@Override
	public String name() {
		return "UCUM";
	}

	@Override
	public String description() {
		return "Unified Code for Units of Measure (UCUM)";
	}

	@Override
	public int totalCount() {
		return -1;
	}

	@Override
	public boolean isNotClosed() {
		return true;
	}

	@Override
	public String specialEnumeration() {
		return commonUnits == null ? null : commonUnits.getUrl();
	}

	@Override
	public VersionAlgorithm versionAlgorithm() {
		return VersionAlgorithm.NATURAL;
	}

	@Override
	public boolean hasAnyDisplays(Languages langs) {
		if (hasAnySupplementDisplays(langs)) {
			return true;
		}
		return langs.isEnglishOrNothing();
	}

	@Override
	public List<Feature> listFeatures() {
		return Collections.singletonList(new Feature("rest.Codesystem:" + system() + ".filter", "canonical:equals"));
	}

	@Override
	protected UcumContext checkContext(ConceptContext ctx) {
		if (ctx instanceof UcumContext) {
			return (UcumContext) ctx;
		}
		throw new InvalidConceptStateException("Not a UCUM context: " + (ctx == null ? "null" : ctx.getClass().getName()));
	}

	// Lookup

	/**
	 * Null and empty codes are not validation failures; both give no context and "Empty code".
	 */
	@Override
	public CompletableFuture<LocateResult> locate(String code) {
		return submit(() -> {
			if (StringUtils.isEmpty(code)) {
				return LocateResult.notFound("Empty code");
			}
			String message = ucumService.validate(code);
			if (message == null) {
				return LocateResult.found(new UcumContext(code));
			}
			LOGGER.debug("UCUM code '{}' rejected: {}", code, message);
			return LocateResult.notFound(message);
		});
	}

	/**
	 * English (or no language) prefers the common units display, then supplements, then the
	 * grammar's analysis.  Other languages use supplements or else the code itself, as there
	 * is no translation of the analysis.
	 */
	@Override
	public CompletableFuture<String> display(ConceptContext ctx) {
		return submit(() -> {
			String code = checkContext(ctx).getCode();
			if (opContext.getLangs().isEnglishOrNothing()) {
				String commonDisplay = commonUnitDisplay(code);
				if (commonDisplay != null) {
					return commonDisplay;
				}
				String supplementDisplay = displayFromSupplements(code);
				if (supplementDisplay != null) {
					return supplementDisplay;
				}
				return ucumService.analyse(code);
			}
			String supplementDisplay = displayFromSupplements(code);
			if (supplementDisplay != null) {
				return supplementDisplay;
			}
			return code;
		});
	}

	private String commonUnitDisplay(String code) {
		if (commonUnits != null) {
			for (CommonUnit unit : commonUnits.findByCode(code)) {
				if (!StringUtils.isBlank(unit.getDisplay())) {
					return unit.getDisplay().trim();
				}
			}
		}
		return null;
	}

	@Override
	public CompletableFuture<String> definition(ConceptContext ctx) {
		return submit(() -> {
			checkContext(ctx);
			return null;
		});
	}

	@Override
	public CompletableFuture<Boolean> isAbstract(ConceptContext ctx) {
		return alwaysFalse(ctx);
	}

	@Override
	public CompletableFuture<Boolean> isInactive(ConceptContext ctx) {
		return alwaysFalse(ctx);
	}

	@Override
	public CompletableFuture<Boolean> isDeprecated(ConceptContext ctx) {
		return alwaysFalse(ctx);
	}

	private CompletableFuture<Boolean> alwaysFalse(ConceptContext ctx) {
		return submit(() -> {
			checkContext(ctx);
			return false;
		});
	}

	@Override
	public CompletableFuture<Void> designations(ConceptContext ctx, ConceptDesignations displays) {
		return submit(() -> {
			String code = checkContext(ctx).getCode();
			displays.addDesignation(true, "active", "en", DesignationUse.DISPLAY, code);
			displays.addDesignation(false, "active", "en", DesignationUse.SYNONYM, ucumService.analyse(code));
			if (commonUnits != null) {
				for (CommonUnit unit : commonUnits.findByCode(code)) {
					if (!StringUtils.isBlank(unit.getDisplay())) {
						String display = unit.getDisplay().trim();
						if (!display.equals(code)) {
							displays.addDesignation(false, "active", "en", DesignationUse.SYNONYM, display);
						}
					}
				}
			}
			listSupplementDesignations(code, displays);
			return null;
		});
	}

	@Override
	public CompletableFuture<Boolean> sameConcept(ConceptContext a, ConceptContext b) {
		return submit(() -> checkContext(a).getCode().equals(checkContext(b).getCode()));
	}

	@Override
	public CompletableFuture<SubsumptionOutcome> subsumesTest(ConceptContext a, ConceptContext b) {
		return submit(() -> {
			checkContext(a);
			checkContext(b);
			return SubsumptionOutcome.NOT_SUBSUMED;
		});
	}

	/**
	 * Adds the canonical form when asked for.  Canonical form is optional here, so failing
	 * to compute it leaves the lookup without it.
	 */
	@Override
	public CompletableFuture<Void> extendLookup(ConceptContext ctx, List<String> props, LookupResult result) {
		return submit(() -> {
			String code = checkContext(ctx).getCode();
			if (hasProp(props, CANONICAL, true)) {
				try {
					result.addProperty(CANONICAL, ucumService.getCanonicalUnits(code));
				} catch (UcumException e) {
					LOGGER.debug("No canonical form for '{}' in lookup: {}", code, e.getMessage());
				}
			}
			return null;
		});
	}

	// Filters

	@Override
	public boolean doesFilter(String prop, String op, String value) {
		Preconditions.checkNotNull(prop, "prop must not be null");
		Preconditions.checkNotNull(op, "op must not be null");
		Preconditions.checkNotNull(value, "value must not be null");
		return CANONICAL.equals(prop) && EQUALS.equals(op);
	}

	@Override
	public CompletableFuture<Void> searchFilter(FilterExecutionContext filterContext, String filter, boolean sort) {
		return failed(new NotImplementedException("Search filter not implemented for UCUM"));
	}

	/**
	 * Enumerates the common units value set in place of the whole code system.
	 */
	@Override
	public CompletableFuture<Void> specialFilter(FilterExecutionContext filterContext, boolean sort) {
		return submit(() -> {
			UcumFilter ucumFilter = new UcumFilter("");
			filterContext.addFilter(ucumFilter);
			if (filterContext.isForIterate()) {
				if (commonUnits == null) {
					throw new FilterPreconditionException("Cannot expand UCUM unless the common units value set is available");
				}
				ucumFilter.materialise(commonUnits.getUnits());
			}
			return null;
		});
	}

	@Override
	public CompletableFuture<Void> filter(FilterExecutionContext filterContext, String prop, String op, String value) {
		return submit(() -> {
			Preconditions.checkNotNull(filterContext, "filterContext must not be null");
			Preconditions.checkNotNull(value, "value must not be null");
			if (!CANONICAL.equals(prop)) {
				throw new UnsupportedFilterException(prop, op, "Unsupported filter property: " + prop);
			}
			if (!EQUALS.equals(op)) {
				throw new UnsupportedFilterException(prop, op, "Unsupported filter operator for canonical: " + op);
			}
			if (StringUtils.isBlank(value)) {
				throw new UnsupportedFilterException(prop, op, "A canonical filter needs a unit to compare with");
			}
			UcumFilter ucumFilter = new UcumFilter(value);
			filterContext.addFilter(ucumFilter);
			if (filterContext.isForIterate()) {
				if (commonUnits == null) {
					throw new FilterPreconditionException("Cannot expand a UCUM filter unless the common units value set is available");
				}
				ucumFilter.materialise(commonUnits.findByCanonical(value));
				LOGGER.debug("UCUM filter canonical = '{}' matched {} common units", value, ucumFilter.getResults().size());
			}
			return null;
		});
	}

	private UcumFilter checkFilter(ConceptFilter filter) {
		if (filter instanceof UcumFilter) {
			return (UcumFilter) filter;
		}
		throw new InvalidConceptStateException("Not a UCUM filter: " + (filter == null ? "null" : filter.getClass().getName()));
	}

	private UcumFilter checkMaterialised(ConceptFilter filter) {
		UcumFilter ucumFilter = checkFilter(filter);
		if (!ucumFilter.isMaterialised()) {
			throw new InvalidConceptStateException("UCUM filter " + ucumFilter + " was not prepared for iteration");
		}
		return ucumFilter;
	}

	@Override
	public CompletableFuture<Integer> filterSize(FilterExecutionContext filterContext, ConceptFilter filter) {
		return submit(() -> checkMaterialised(filter).getResults().size());
	}

	@Override
	public CompletableFuture<Boolean> filtersNotClosed(FilterExecutionContext filterContext) {
		return CompletableFuture.completedFuture(true);
	}

	@Override
	public CompletableFuture<Boolean> filterMore(FilterExecutionContext filterContext, ConceptFilter filter) {
		return submit(() -> checkMaterialised(filter).advance());
	}

	@Override
	public CompletableFuture<ConceptContext> filterConcept(FilterExecutionContext filterContext, ConceptFilter filter) {
		return submit(() -> new UcumContext(checkMaterialised(filter).current().getCode()));
	}

	@Override
	public CompletableFuture<LocateResult> filterLocate(FilterExecutionContext filterContext, ConceptFilter filter, String code) {
		return submit(() -> {
			UcumFilter ucumFilter = checkFilter(filter);
			Preconditions.checkNotNull(code, "code must not be null");
			String message = ucumService.validate(code);
			if (message != null) {
				return LocateResult.notFound("Invalid UCUM code: " + message);
			}
			if (!ucumFilter.hasCanonical()) {
				if (commonUnits == null || commonUnits.contains(code)) {
					return LocateResult.found(new UcumContext(code));
				}
				return LocateResult.notFound("Code " + code + " is not in the common units enumeration");
			}
			try {
				String canonical = ucumService.getCanonicalUnits(code);
				if (ucumFilter.getCanonical().equals(canonical)) {
					return LocateResult.found(new UcumContext(code));
				}
				return LocateResult.notFound("Code " + code + " has canonical form " + canonical + ", not " + ucumFilter.getCanonical() + " as required");
			} catch (UcumException e) {
				return LocateResult.notFound("Error getting canonical form for " + code + ": " + e.getMessage());
			}
		});
	}

	@Override
	public CompletableFuture<Boolean> filterCheck(FilterExecutionContext filterContext, ConceptFilter filter, ConceptContext ctx) {
		return submit(() -> {
			UcumFilter ucumFilter = checkFilter(filter);
			String code = checkContext(ctx).getCode();
			if (!ucumFilter.hasCanonical()) {
				return commonUnits == null || commonUnits.contains(code);
			}
			try {
				return ucumFilter.getCanonical().equals(ucumService.getCanonicalUnits(code));
			} catch (UcumException e) {
				LOGGER.debug("No canonical form for '{}' checking {}: {}", code, ucumFilter, e.getMessage());
				return false;
			}
		});
	}
}
