package org.ihtsdo.termserver.tx.context;

import java.util.*;
import java.util.concurrent.TimeUnit;

import org.ihtsdo.termserver.tx.CircularReferenceException;
import org.ihtsdo.termserver.tx.TooCostlyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per request state consumed by providers: the requested languages, a time budget and
 * the value sets currently being evaluated.  Not shared between requests.
 */
public class OperationContext {

	private static final Logger LOGGER = LoggerFactory.getLogger(OperationContext.class);

	public static final int DEFAULT_TIME_LIMIT_SECONDS = 30;

	private final Languages langs;
	private final String id;
	private final long timeLimitMillis;
	private long startTime;
	private List<String> contexts = new ArrayList<>();
	private List<String> logEntries = new ArrayList<>();

	public OperationContext(Languages langs) {
		this(langs, null, DEFAULT_TIME_LIMIT_SECONDS);
	}

	public OperationContext(String acceptLanguage) {
		this(Languages.fromAcceptLanguage(acceptLanguage));
	}

	public OperationContext(Languages langs, String id, int timeLimitSeconds) {
		if (langs == null) {
			throw new IllegalArgumentException("Languages must be supplied, use Languages.none() if there are none");
		}
		this.langs = langs;
		this.id = id == null ? "op_" + UUID.randomUUID() : id;
		this.timeLimitMillis = TimeUnit.SECONDS.toMillis(timeLimitSeconds);
		this.startTime = System.nanoTime();
		log("tx-op");
	}

	public OperationContext copy() {
		OperationContext copy = new OperationContext(langs, id, (int) TimeUnit.MILLISECONDS.toSeconds(timeLimitMillis));
		copy.startTime = startTime;
		copy.contexts = new ArrayList<>(contexts);
		copy.logEntries = new ArrayList<>(logEntries);
		return copy;
	}

	public Languages getLangs() {
		return langs;
	}

	public String getId() {
		return id;
	}

	private long elapsedMillis() {
		return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);
	}

	public void deadCheck(String place) throws TooCostlyException {
		if (elapsedMillis() > timeLimitMillis) {
			log("Operation took too long @ " + place);
			long seconds = TimeUnit.MILLISECONDS.toSeconds(timeLimitMillis);
			throw new TooCostlyException("Operation exceeded time limit of " + seconds + " seconds at " + place, diagnostics());
		}
	}

	public void seeContext(String vurl) throws CircularReferenceException {
		if (contexts.contains(vurl)) {
			throw new CircularReferenceException("Circular reference detected for " + vurl + " in contexts: " + contexts);
		}
		contexts.add(vurl);
	}

	public void clearContexts() {
		contexts.clear();
	}

	public void log(String note) {
		String entry = elapsedMillis() + "ms " + note;
		logEntries.add(entry);
		LOGGER.debug("{}: {}", id, entry);
	}

	public List<String> getLogEntries() {
		return Collections.unmodifiableList(logEntries);
	}

	public String diagnostics() {
		return String.join("\n", logEntries);
	}
}
