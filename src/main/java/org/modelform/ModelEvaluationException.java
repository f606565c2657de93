package org.modelform;

/**
 * Thrown when a scope resolution or an expression evaluation fails. Only the request that raised it is aborted; the loaded model is
 * unaffected.
 */
public abstract class ModelEvaluationException extends ModelFormException {
	/** @see ModelFormException#ModelFormException(ErrorKind, String, String) */
	protected ModelEvaluationException(ErrorKind kind, String path, String message) {
		super(kind, path, message);
	}

	/** @see ModelFormException#ModelFormException(ErrorKind, String, String, Throwable) */
	protected ModelEvaluationException(ErrorKind kind, String path, String message, Throwable cause) {
		super(kind, path, message, cause);
	}
}
