package org.modelform;

/** Thrown when a type reference cannot be resolved to a definition */
public class TypeNotFoundException extends ModelLoadException {
	private final String theTypeReference;

	/**
	 * @param typeReference The type reference that could not be found
	 * @param path The path of the definition that referred to the type
	 */
	public TypeNotFoundException(String typeReference, String path) {
		super(ErrorKind.TYPE_NOT_FOUND, path, "Type '" + typeReference + "' not found");
		theTypeReference = typeReference;
	}

	/**
	 * @param typeReference The type reference that could not be found
	 * @param path The path of the definition that referred to the type
	 * @param cause The failure reading the type's source
	 */
	public TypeNotFoundException(String typeReference, String path, Throwable cause) {
		super(ErrorKind.TYPE_NOT_FOUND, path, "Type '" + typeReference + "' could not be read", cause);
		theTypeReference = typeReference;
	}

	/** @return The type reference that could not be found */
	public String getTypeReference() {
		return theTypeReference;
	}
}
