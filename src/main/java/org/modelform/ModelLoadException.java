package org.modelform;

/**
 * Thrown when a model cannot be loaded because its source is internally inconsistent. The model cannot be partially rendered; no type
 * dictionary is produced.
 */
public abstract class ModelLoadException extends ModelFormException {
	/** @see ModelFormException#ModelFormException(ErrorKind, String, String) */
	protected ModelLoadException(ErrorKind kind, String path, String message) {
		super(kind, path, message);
	}

	/** @see ModelFormException#ModelFormException(ErrorKind, String, String, Throwable) */
	protected ModelLoadException(ErrorKind kind, String path, String message, Throwable cause) {
		super(kind, path, message, cause);
	}
}
