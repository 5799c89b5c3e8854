package org.ihtsdo.termserver.tx.provider;

import java.util.*;
import java.util.function.Supplier;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The provider factories known to a terminology server, keyed by code system, version
 * and enumeration.
 */
public class ProviderFactoryCache {

	private static final Logger LOGGER = LoggerFactory.getLogger(ProviderFactoryCache.class);

	private final Map<FactoryKey, CodeSystemProviderFactory> factories = new LinkedHashMap<>();

	/**
	 * @return the factory now held for the key, which is the existing one if the key was already registered
	 */
	public synchronized CodeSystemProviderFactory register(CodeSystemProviderFactory factory) {
		FactoryKey key = factory.getKey();
		CodeSystemProviderFactory existing = factories.get(key);
		if (existing != null) {
			LOGGER.warn("Factory already registered for {}, keeping the existing one", key);
			return existing;
		}
		LOGGER.info("Registering {} provider factory for {}", factory.name(), key);
		factories.put(key, factory);
		return factory;
	}

	public synchronized CodeSystemProviderFactory getOrCreate(FactoryKey key, Supplier<? extends CodeSystemProviderFactory> creator) {
		CodeSystemProviderFactory factory = factories.get(key);
		if (factory == null) {
			factory = creator.get();
			if (!key.equals(factory.getKey())) {
				throw new IllegalStateException("Factory created for " + key + " reports key " + factory.getKey());
			}
			LOGGER.debug("Created provider factory for {}", key);
			factories.put(key, factory);
		}
		return factory;
	}

	public synchronized CodeSystemProviderFactory get(FactoryKey key) {
		return factories.get(key);
	}

	/**
	 * @param version may be null, in which case the first factory registered for the system is used
	 */
	public synchronized CodeSystemProviderFactory getFactory(String system, String version) {
		for (CodeSystemProviderFactory factory : factories.values()) {
			FactoryKey key = factory.getKey();
			if (key.getSystem().equals(system)
					&& (StringUtils.isEmpty(version) || version.equals(key.getVersion()) || version.equals(factory.getPartialVersion()))) {
				return factory;
			}
		}
		return null;
	}

	public synchronized List<CodeSystemProviderFactory> getFactories() {
		return new ArrayList<>(factories.values());
	}

	public synchronized int size() {
		return factories.size();
	}

	public synchronized void reset() {
		LOGGER.info("Resetting provider factory cache, closing {} factories", factories.size());
		for (CodeSystemProviderFactory factory : factories.values()) {
			factory.close();
		}
		factories.clear();
	}
}
