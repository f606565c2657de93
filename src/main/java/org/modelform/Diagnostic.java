package org.modelform;

import java.util.Objects;

/** A problem recorded while loading or evaluating a model */
public final class Diagnostic {
	/** The severity of a diagnostic */
	public enum Severity {
		/** The problem was recovered from with a substituted default */
		WARNING,
		/** The problem aborted a load or a resolution */
		ERROR
	}

	private final ErrorKind theKind;
	private final Severity theSeverity;
	private final String thePath;
	private final String theMessage;

	/**
	 * @param kind The kind of the problem
	 * @param severity The severity of the problem
	 * @param path The dotted path at which the problem was found, or null
	 * @param message The message describing the problem
	 */
	public Diagnostic(ErrorKind kind, Severity severity, String path, String message) {
		theKind = Objects.requireNonNull(kind, "kind");
		theSeverity = Objects.requireNonNull(severity, "severity");
		thePath = path;
		theMessage = message;
	}

	/**
	 * @param ex The exception that aborted an operation
	 * @return An {@link Severity#ERROR error} diagnostic describing the exception
	 */
	public static Diagnostic of(ModelFormException ex) {
		return new Diagnostic(ex.getKind(), Severity.ERROR, ex.getPath(), ex.getMessage());
	}

	/** @return The kind of the problem */
	public ErrorKind getKind() {
		return theKind;
	}

	/** @return The severity of the problem */
	public Severity getSeverity() {
		return theSeverity;
	}

	/** @return The dotted path at which the problem was found, or null */
	public String getPath() {
		return thePath;
	}

	/** @return The message describing the problem */
	public String getMessage() {
		return theMessage;
	}

	@Override
	public int hashCode() {
		return Objects.hash(theKind, theSeverity, thePath, theMessage);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this)
			return true;
		else if (!(obj instanceof Diagnostic))
			return false;
		Diagnostic other = (Diagnostic) obj;
		return theKind == other.theKind && theSeverity == other.theSeverity && Objects.equals(thePath, other.thePath)
			&& Objects.equals(theMessage, other.theMessage);
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder().append(theSeverity).append(' ').append(theKind);
		if (thePath != null)
			str.append(" @").append(thePath);
		return str.append(": ").append(theMessage).toString();
	}
}
