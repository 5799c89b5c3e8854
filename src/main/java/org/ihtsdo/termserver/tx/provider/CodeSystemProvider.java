package org.ihtsdo.termserver.tx.provider;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.apache.commons.lang.NotImplementedException;
import org.apache.commons.lang.StringUtils;
import org.ihtsdo.termserver.tx.InvalidConceptStateException;
import org.ihtsdo.termserver.tx.TerminologyException;
import org.ihtsdo.termserver.tx.UnsupportedFilterException;
import org.ihtsdo.termserver.tx.context.Language;
import org.ihtsdo.termserver.tx.context.Languages;
import org.ihtsdo.termserver.tx.context.OperationContext;
import org.ihtsdo.termserver.tx.domain.*;
import org.ihtsdo.termserver.tx.domain.CodeSystemSupplement.SupplementConcept;
import org.ihtsdo.termserver.tx.domain.CodeSystemSupplement.SupplementDesignation;
import org.ihtsdo.termserver.tx.render.CodedTextFormatter;
import org.ihtsdo.termserver.tx.render.DisplayRequest;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;

/**
 * The contract between the terminology engine and a single code system.
 * <p>
 * Metadata methods answer immediately.  Anything that looks at a code may need to consult a
 * grammar, an index or a supplement, so those methods return futures and run on the
 * provider's executor.  Validation failures are reported as data ({@link LocateResult});
 * configuration problems complete the future exceptionally with a {@link TerminologyException}.
 * <p>
 * Providers are built per operation by a {@link CodeSystemProviderFactory} and hold no
 * per-call state, so they can be shared by concurrent read-only calls.
 */
public abstract class CodeSystemProvider {

	protected final OperationContext opContext;
	protected final List<CodeSystemSupplement> supplements;
	protected final Executor executor;

	protected CodeSystemProvider(OperationContext opContext, List<CodeSystemSupplement> supplements) {
		this(opContext, supplements, MoreExecutors.directExecutor());
	}

	protected CodeSystemProvider(OperationContext opContext, List<CodeSystemSupplement> supplements, Executor executor) {
		this.opContext = Preconditions.checkNotNull(opContext, "opContext is required");
		this.executor = Preconditions.checkNotNull(executor, "executor is required");
		if (supplements == null) {
			this.supplements = Collections.emptyList();
		} else {
			for (int i = 0; i < supplements.size(); i++) {
				if (supplements.get(i) == null) {
					throw new IllegalArgumentException("Supplement " + i + " is null");
				}
			}
			this.supplements = ImmutableList.copyOf(supplements);
		}
	}

	@FunctionalInterface
	protected interface TerminologyTask<T> {
		T call() throws TerminologyException;
	}

	/**
	 * Runs the task on this provider's executor.  Checked and unchecked failures both
	 * complete the returned future exceptionally.
	 */
	protected <T> CompletableFuture<T> submit(TerminologyTask<T> task) {
		CompletableFuture<T> future = new CompletableFuture<>();
		try {
			executor.execute(() -> {
				try {
					future.complete(task.call());
				} catch (TerminologyException | RuntimeException e) {
					future.completeExceptionally(e);
				}
			});
		} catch (RejectedExecutionException e) {
			future.completeExceptionally(e);
		}
		return future;
	}

	protected static <T> CompletableFuture<T> failed(Throwable t) {
		CompletableFuture<T> future = new CompletableFuture<>();
		future.completeExceptionally(t);
		return future;
	}

	public OperationContext getOpContext() {
		return opContext;
	}

	// Metadata

	public abstract String system();

	public abstract String version();

	public abstract String description();

	/**
	 * @return the number of concepts, or -1 if the code system cannot be counted
	 */
	public abstract int totalCount();

	public String name() {
		return vurl();
	}

	public String vurl() {
		return StringUtils.isEmpty(version()) ? system() : system() + "|" + version();
	}

	public String defLang() {
		return "en";
	}

	public CodeSystemContentMode contentMode() {
		return CodeSystemContentMode.COMPLETE;
	}

	/**
	 * @return agreed limit on expansion size, 0 for none
	 */
	public int expandLimitation() {
		return 0;
	}

	public String sourcePackage() {
		return null;
	}

	/**
	 * @return true if the code system cannot be completely enumerated, eg it is defined by a grammar
	 */
	public boolean isNotClosed() {
		return false;
	}

	public boolean isCaseSensitive() {
		return true;
	}

	public boolean hasParents() {
		return false;
	}

	/**
	 * @return url of a value set to enumerate in place of the code system, if it nominates one
	 */
	public String specialEnumeration() {
		return null;
	}

	public VersionAlgorithm versionAlgorithm() {
		return null;
	}

	public boolean versionNeeded() {
		return false;
	}

	public List<Feature> listFeatures() {
		return Collections.emptyList();
	}

	public boolean hasAnyDisplays(Languages langs) {
		return hasAnySupplementDisplays(langs) || langs.isEnglishOrNothing();
	}

	public boolean hasSupplement(String url) {
		for (CodeSystemSupplement supplement : supplements) {
			if (StringUtils.equals(supplement.getUrl(), url) || StringUtils.equals(supplement.getVurl(), url)) {
				return true;
			}
		}
		return false;
	}

	public List<String> listSupplements() {
		List<String> urls = new ArrayList<>();
		for (CodeSystemSupplement supplement : supplements) {
			urls.add(supplement.getVurl());
		}
		return urls;
	}

	// Concept information

	public abstract CompletableFuture<LocateResult> locate(String code);

	public CompletableFuture<String> code(ConceptContext ctx) {
		return submit(() -> checkContext(ctx).getCode());
	}

	public abstract CompletableFuture<String> display(ConceptContext ctx);

	public CompletableFuture<String> display(String code) {
		return resolve(code).thenCompose(this::display);
	}

	public CompletableFuture<String> definition(ConceptContext ctx) {
		return CompletableFuture.completedFuture(null);
	}

	public CompletableFuture<Boolean> isAbstract(ConceptContext ctx) {
		return CompletableFuture.completedFuture(false);
	}

	public CompletableFuture<Boolean> isInactive(ConceptContext ctx) {
		return CompletableFuture.completedFuture(false);
	}

	public CompletableFuture<Boolean> isDeprecated(ConceptContext ctx) {
		return CompletableFuture.completedFuture(false);
	}

	public CompletableFuture<String> getStatus(ConceptContext ctx) {
		return CompletableFuture.completedFuture(null);
	}

	public CompletableFuture<Void> designations(ConceptContext ctx, ConceptDesignations displays) {
		return CompletableFuture.completedFuture(null);
	}

	public CompletableFuture<Boolean> sameConcept(ConceptContext a, ConceptContext b) {
		return CompletableFuture.completedFuture(false);
	}

	public CompletableFuture<Boolean> sameConcept(String a, String b) {
		return resolve(a).thenCombine(resolve(b), (ca, cb) -> new ConceptContext[] { ca, cb })
				.thenCompose(pair -> sameConcept(pair[0], pair[1]));
	}

	public CompletableFuture<LocateResult> locateIsA(String code, String parent) {
		if (hasParents()) {
			return failed(new NotImplementedException(getClass().getSimpleName() + " must implement locateIsA"));
		}
		return CompletableFuture.completedFuture(LocateResult.notFound("The CodeSystem " + name() + " does not have parents"));
	}

	public CompletableFuture<SubsumptionOutcome> subsumesTest(ConceptContext a, ConceptContext b) {
		return CompletableFuture.completedFuture(SubsumptionOutcome.NOT_SUBSUMED);
	}

	public CompletableFuture<SubsumptionOutcome> subsumesTest(String a, String b) {
		return resolve(a).thenCombine(resolve(b), (ca, cb) -> new ConceptContext[] { ca, cb })
				.thenCompose(pair -> subsumesTest(pair[0], pair[1]));
	}

	public CompletableFuture<Void> extendLookup(ConceptContext ctx, List<String> props, LookupResult result) {
		return CompletableFuture.completedFuture(null);
	}

	/**
	 * Resolves a bare code to a context.  The code is expected to be valid, so a code that
	 * can't be located completes the future with an {@link InvalidConceptStateException}.
	 */
	protected CompletableFuture<ConceptContext> resolve(String code) {
		return locate(code).thenApply(result -> {
			if (!result.isFound()) {
				throw new InvalidConceptStateException(result.getMessage());
			}
			return result.getContext();
		});
	}

	/**
	 * Confirms a context was created by this provider.
	 */
	protected abstract ConceptContext checkContext(ConceptContext ctx);

	// Filters

	public boolean doesFilter(String prop, String op, String value) {
		return false;
	}

	public FilterExecutionContext getPrepContext(boolean iterate) {
		return new FilterExecutionContext(iterate);
	}

	public CompletableFuture<Void> searchFilter(FilterExecutionContext filterContext, String filter, boolean sort) {
		return failed(new NotImplementedException("Text search is not supported for " + name()));
	}

	public CompletableFuture<Void> specialFilter(FilterExecutionContext filterContext, boolean sort) {
		if (specialEnumeration() != null) {
			return failed(new NotImplementedException(getClass().getSimpleName() + " must implement specialFilter"));
		}
		return CompletableFuture.completedFuture(null);
	}

	public CompletableFuture<Void> filter(FilterExecutionContext filterContext, String prop, String op, String value) {
		return failed(new UnsupportedFilterException(prop, op, "The filter " + prop + " " + op + " " + value + " is not supported for " + name()));
	}

	/**
	 * Called once all filters are registered.  Providers that join filters themselves return
	 * fewer sets than were registered; otherwise the caller combines them.
	 */
	public CompletableFuture<List<ConceptFilter>> executeFilters(FilterExecutionContext filterContext) {
		return CompletableFuture.completedFuture(filterContext.getFilters());
	}

	public CompletableFuture<Integer> filterSize(FilterExecutionContext filterContext, ConceptFilter filter) {
		return failed(new NotImplementedException("Filters are not supported for " + name()));
	}

	public CompletableFuture<Boolean> filtersNotClosed(FilterExecutionContext filterContext) {
		return CompletableFuture.completedFuture(false);
	}

	/**
	 * Moves the filter forward.  Iterate with {@code while (filterMore(..)) { filterConcept(..) }}.
	 */
	public CompletableFuture<Boolean> filterMore(FilterExecutionContext filterContext, ConceptFilter filter) {
		return failed(new NotImplementedException("Filters are not supported for " + name()));
	}

	public CompletableFuture<ConceptContext> filterConcept(FilterExecutionContext filterContext, ConceptFilter filter) {
		return failed(new NotImplementedException("Filters are not supported for " + name()));
	}

	/**
	 * Finds a code within a filter without iterating.  When the code isn't a member the
	 * result carries the reason.
	 */
	public CompletableFuture<LocateResult> filterLocate(FilterExecutionContext filterContext, ConceptFilter filter, String code) {
		return failed(new NotImplementedException("Filters are not supported for " + name()));
	}

	public CompletableFuture<Boolean> filterCheck(FilterExecutionContext filterContext, ConceptFilter filter, ConceptContext ctx) {
		return failed(new NotImplementedException("Filters are not supported for " + name()));
	}

	public void filterFinish(FilterExecutionContext filterContext) {
		filterContext.clear();
	}

	// Supplements

	private boolean supplementLanguageMatches(CodeSystemSupplement supplement, Languages langs) {
		if (StringUtils.isEmpty(supplement.getLanguage())) {
			return false;
		}
		Language supplementLang = new Language(supplement.getLanguage());
		for (Language requested : langs) {
			if (supplementLang.matchesForDisplay(requested)) {
				return true;
			}
		}
		return false;
	}

	protected boolean hasAnySupplementDisplays(Languages langs) {
		for (CodeSystemSupplement supplement : supplements) {
			if (supplementLanguageMatches(supplement, langs)) {
				for (SupplementConcept concept : supplement.getAllConcepts()) {
					if (!StringUtils.isEmpty(concept.getDisplay())) {
						return true;
					}
				}
			}
		}
		for (CodeSystemSupplement supplement : supplements) {
			for (SupplementConcept concept : supplement.getAllConcepts()) {
				for (SupplementDesignation d : concept.getDesignation()) {
					if (DesignationUse.isDisplay(d.getUse()) && langs.hasMatch(d.getLanguage())) {
						return true;
					}
				}
			}
		}
		return false;
	}

	/**
	 * @return the best display for the code from the supplements, given the request languages, or null
	 */
	protected String displayFromSupplements(String code) {
		Languages langs = opContext.getLangs();
		for (CodeSystemSupplement supplement : supplements) {
			if (supplementLanguageMatches(supplement, langs)) {
				SupplementConcept concept = supplement.getConceptByCode(code);
				if (concept != null && !StringUtils.isEmpty(concept.getDisplay())) {
					return concept.getDisplay();
				}
			}
		}
		//Designations carry their own language, whatever the supplement's language is
		for (CodeSystemSupplement supplement : supplements) {
			SupplementConcept concept = supplement.getConceptByCode(code);
			if (concept == null) {
				continue;
			}
			for (SupplementDesignation d : concept.getDesignation()) {
				if (DesignationUse.isDisplay(d.getUse()) && langs.hasMatch(d.getLanguage())) {
					return d.getValue();
				}
			}
		}
		//Still here? Take a display from any supplement that doesn't declare a language
		for (CodeSystemSupplement supplement : supplements) {
			if (StringUtils.isEmpty(supplement.getLanguage())) {
				SupplementConcept concept = supplement.getConceptByCode(code);
				if (concept != null && !StringUtils.isEmpty(concept.getDisplay())) {
					return concept.getDisplay();
				}
			}
		}
		return null;
	}

	protected void listSupplementDesignations(String code, ConceptDesignations displays) {
		for (CodeSystemSupplement supplement : supplements) {
			SupplementConcept concept = supplement.getConceptByCode(code);
			if (concept != null) {
				if (!StringUtils.isEmpty(concept.getDisplay())) {
					displays.addDesignation(true, "active", supplement.getLanguage(), null, concept.getDisplay());
				}
				for (SupplementDesignation d : concept.getDesignation()) {
					displays.addDesignation(false, "active", d.getLanguage(), d.getUse(), d.getValue());
				}
			}
		}
	}

	/**
	 * An empty property list means everything was asked for, as does "*".
	 */
	protected static boolean hasProp(List<String> props, String name, boolean defaultValue) {
		if (props == null || props.isEmpty()) {
			return defaultValue;
		}
		for (String p : props) {
			if (p.equalsIgnoreCase(name) || p.equals("*")) {
				return true;
			}
		}
		return false;
	}

	@Override
	public String toString() {
		return new CodedTextFormatter().format(DisplayRequest.of(this));
	}
}
