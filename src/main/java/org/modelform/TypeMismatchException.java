package org.modelform;

/** Thrown when values of incompatible kinds are combined by an operator or assigned to a typed component */
public class TypeMismatchException extends ModelEvaluationException {
	/**
	 * @param path The instance path whose evaluation failed, or null if unknown
	 * @param message Describes the incompatible values
	 */
	public TypeMismatchException(String path, String message) {
		super(ErrorKind.TYPE_MISMATCH, path, message);
	}
}
