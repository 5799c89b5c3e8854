package org.ihtsdo.termserver.tx.provider;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.ihtsdo.termserver.tx.context.OperationContext;
import org.ihtsdo.termserver.tx.domain.CodeSystemSupplement;
import org.ihtsdo.termserver.tx.domain.ValueSet;
import org.ihtsdo.termserver.tx.util.VersionUtils;

/**
 * Builds providers for one code system.  Expensive preparation happens once when the factory
 * is constructed; after that the only state that changes is the use count.
 */
public abstract class CodeSystemProviderFactory {

	private final AtomicInteger uses = new AtomicInteger();

	public abstract CodeSystemProvider build(OperationContext opContext, List<CodeSystemSupplement> supplements);

	public abstract String system();

	public abstract String version();

	public abstract String name();

	public abstract String id();

	public String defaultVersion() {
		return version();
	}

	/**
	 * @return major.minor when the version is semver, otherwise the version as is
	 */
	public String getPartialVersion() {
		String ver = version();
		if (VersionUtils.isSemVer(ver)) {
			return VersionUtils.getMajMin(ver);
		}
		return ver;
	}

	/**
	 * @return a value set the code system defines implicitly, or null
	 */
	public ValueSet buildKnownValueSet(String url, String version) {
		return null;
	}

	public boolean iteratable() {
		return false;
	}

	public FactoryKey getKey() {
		return new FactoryKey(system(), version(), null);
	}

	public int useCount() {
		return uses.get();
	}

	protected void recordUse() {
		uses.incrementAndGet();
	}

	public void close() {
		//Nothing held by default
	}

	@Override
	public String toString() {
		return name() + " factory for " + getKey() + " (used " + useCount() + " times)";
	}
}
