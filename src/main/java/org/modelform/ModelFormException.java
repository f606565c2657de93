package org.modelform;

/** An error that occurs loading a model or evaluating values against it */
public abstract class ModelFormException extends Exception {
	private final ErrorKind theKind;
	private final String thePath;

	/**
	 * @param kind The kind of the problem
	 * @param path The dotted path (type path or instance path) at which the problem was found, or null if not applicable
	 * @param message The message for the exception
	 */
	protected ModelFormException(ErrorKind kind, String path, String message) {
		super(path == null ? message : message + " at " + path);
		theKind = kind;
		thePath = path;
	}

	/**
	 * @param kind The kind of the problem
	 * @param path The dotted path (type path or instance path) at which the problem was found, or null if not applicable
	 * @param message The message for the exception
	 * @param cause The cause of the exception
	 */
	protected ModelFormException(ErrorKind kind, String path, String message, Throwable cause) {
		super(path == null ? message : message + " at " + path, cause);
		theKind = kind;
		thePath = path;
	}

	/** @return The kind of the problem */
	public ErrorKind getKind() {
		return theKind;
	}

	/** @return The dotted path at which the problem was found, or null if not applicable */
	public String getPath() {
		return thePath;
	}
}
