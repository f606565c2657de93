package org.modelform;

/** Thrown when a variable reference cannot be resolved to a value */
public class UnresolvedVariableException extends ModelEvaluationException {
	private final String theReference;

	/**
	 * @param reference The variable reference
	 * @param path The instance path against which the reference was resolved, or null for the root
	 */
	public UnresolvedVariableException(String reference, String path) {
		super(ErrorKind.UNRESOLVED_VARIABLE, path, "Variable '" + reference + "' has no value");
		theReference = reference;
	}

	/** @return The variable reference */
	public String getReference() {
		return theReference;
	}
}
