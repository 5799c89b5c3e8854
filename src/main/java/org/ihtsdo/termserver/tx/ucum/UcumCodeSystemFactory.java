package org.ihtsdo.termserver.tx.ucum;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import org.apache.commons.lang.StringUtils;
import org.ihtsdo.termserver.tx.context.OperationContext;
import org.ihtsdo.termserver.tx.domain.CodeSystemSupplement;
import org.ihtsdo.termserver.tx.domain.ValueSet;
import org.ihtsdo.termserver.tx.domain.ValueSet.ConceptReference;
import org.ihtsdo.termserver.tx.provider.CodeSystemProviderFactory;
import org.ihtsdo.termserver.tx.provider.FactoryKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.MoreExecutors;

/**
 * Builds UCUM providers.  The canonical form of every common unit is worked out once, here,
 * and shared by every provider built.
 */
public class UcumCodeSystemFactory extends CodeSystemProviderFactory {

	private static final Logger LOGGER = LoggerFactory.getLogger(UcumCodeSystemFactory.class);

	private final UcumService ucumService;
	private final CommonUnits commonUnits;
	private final Executor executor;

	public UcumCodeSystemFactory(UcumService ucumService) {
		this(ucumService, null, MoreExecutors.directExecutor());
	}

	public UcumCodeSystemFactory(UcumService ucumService, ValueSet commonUnitsValueSet) {
		this(ucumService, commonUnitsValueSet, MoreExecutors.directExecutor());
	}

	public UcumCodeSystemFactory(UcumService ucumService, ValueSet commonUnitsValueSet, Executor executor) {
		this.ucumService = Preconditions.checkNotNull(ucumService, "ucumService is required");
		this.executor = Preconditions.checkNotNull(executor, "executor is required");
		this.commonUnits = commonUnitsValueSet == null ? null : processCommonUnits(commonUnitsValueSet);
	}

	/**
	 * Reads the concepts of the value set's first include.  Codes the grammar rejects are dropped.
	 * A unit whose canonical form can't be computed is still listed, just without a canonical form.
	 */
	CommonUnits processCommonUnits(ValueSet vs) {
		List<CommonUnit> units = new ArrayList<>();
		int failures = 0;
		int rejected = 0;
		if (vs.getCompose() != null && !vs.getCompose().getInclude().isEmpty()) {
			for (ConceptReference c : vs.getCompose().getInclude().get(0).getConcept()) {
				if (StringUtils.isEmpty(c.getCode())) {
					LOGGER.warn("Skipping common unit without a code in {}", vs.getUrl());
					continue;
				}
				String invalid = ucumService.validate(c.getCode());
				if (invalid != null) {
					rejected++;
					LOGGER.warn("Skipping invalid common unit '{}' in {}: {}", c.getCode(), vs.getUrl(), invalid);
					continue;
				}
				String canonical = null;
				try {
					canonical = StringUtils.trimToNull(ucumService.getCanonicalUnits(c.getCode()));
				} catch (UcumException e) {
					failures++;
					LOGGER.debug("Common unit '{}' has no canonical form: {}", c.getCode(), e.getMessage());
				}
				units.add(new CommonUnit(c.getCode(), c.getDisplay(), canonical));
			}
		} else {
			LOGGER.warn("Common units value set {} has no enumerated include", vs.getUrl());
		}
		LOGGER.info("Loaded {} common units from {} ({} invalid, {} without canonical form)", units.size(), vs.getUrl(), rejected, failures);
		return new CommonUnits(vs.getUrl(), units);
	}

	public CommonUnits getCommonUnits() {
		return commonUnits;
	}

	@Override
	public UcumCodeSystemProvider build(OperationContext opContext, List<CodeSystemSupplement> supplements) {
		recordUse();
		return new UcumCodeSystemProvider(opContext, supplements, ucumService, commonUnits, executor);
	}

	@Override
	public String system() {
		return UcumCodeSystemProvider.SYSTEM;
	}

	@Override
	public String version() {
		return ucumService.ucumIdentification().getVersion();
	}

	@Override
	public String defaultVersion() {
		UcumVersionDetails details = ucumService.ucumIdentification();
		return details == null ? "" : details.getVersion();
	}

	@Override
	public String name() {
		return "UCUM";
	}

	@Override
	public String id() {
		return "ucum";
	}

	@Override
	public FactoryKey getKey() {
		return new FactoryKey(system(), version(), commonUnits == null ? null : commonUnits.getUrl());
	}
}
