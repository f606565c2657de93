package org.modelform;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableList;

/** An append-only, thread-safe record of the problems encountered by a load or a resolution */
public class Diagnostics {
	private static final Logger LOGGER = LogManager.getLogger(Diagnostics.class);

	private final List<Diagnostic> theEntries;

	/** Creates an empty record */
	public Diagnostics() {
		theEntries = new ArrayList<>();
	}

	/**
	 * Records and logs a problem
	 *
	 * @param diagnostic The problem to record
	 * @return This record
	 */
	public Diagnostics add(Diagnostic diagnostic) {
		synchronized (theEntries) {
			theEntries.add(diagnostic);
		}
		if (diagnostic.getSeverity() == Diagnostic.Severity.ERROR)
			LOGGER.error("{}", diagnostic);
		else
			LOGGER.warn("{}", diagnostic);
		return this;
	}

	/**
	 * Records a problem that was recovered from
	 *
	 * @param kind The kind of the problem
	 * @param path The dotted path at which the problem was found
	 * @param message Describes the problem and the substituted default
	 * @return This record
	 */
	public Diagnostics warn(ErrorKind kind, String path, String message) {
		return add(new Diagnostic(kind, Diagnostic.Severity.WARNING, path, message));
	}

	/**
	 * Records a problem that aborted an operation
	 *
	 * @param ex The exception that will propagate to the caller
	 * @return This record
	 */
	public Diagnostics error(ModelFormException ex) {
		return add(Diagnostic.of(ex));
	}

	/** @return A snapshot of all recorded problems, in the order they were recorded */
	public List<Diagnostic> getAll() {
		synchronized (theEntries) {
			return ImmutableList.copyOf(theEntries);
		}
	}

	/**
	 * @param kind The kind of problem to get
	 * @return A snapshot of all recorded problems of the given kind
	 */
	public List<Diagnostic> get(ErrorKind kind) {
		ImmutableList.Builder<Diagnostic> found = ImmutableList.builder();
		synchronized (theEntries) {
			for (Diagnostic d : theEntries) {
				if (d.getKind() == kind)
					found.add(d);
			}
		}
		return found.build();
	}

	/** @return Whether no problems have been recorded */
	public boolean isEmpty() {
		synchronized (theEntries) {
			return theEntries.isEmpty();
		}
	}

	@Override
	public String toString() {
		return getAll().toString();
	}
}
