package org.modelform;

/** Thrown when a definition refers to a child path that does not exist in the type dictionary */
public class DanglingReferenceException extends ModelLoadException {
	private final String theReference;

	/**
	 * @param path The path of the definition containing the bad reference
	 * @param reference The child path that does not exist
	 */
	public DanglingReferenceException(String path, String reference) {
		super(ErrorKind.DANGLING_REFERENCE, path, "Child '" + reference + "' does not exist");
		theReference = reference;
	}

	/** @return The child path that does not exist */
	public String getReference() {
		return theReference;
	}
}
