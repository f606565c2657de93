package org.modelform;

/** Thrown when an expression uses an operator that is not supported, or supplies the wrong number of operands to it */
public class UnknownOperatorException extends ModelEvaluationException {
	private final String theOperator;

	/**
	 * @param operator The operator name
	 * @param operandCount The number of operands given to the operator
	 * @param path The instance path whose evaluation encountered the operator, or null if unknown
	 */
	public UnknownOperatorException(String operator, int operandCount, String path) {
		super(ErrorKind.UNKNOWN_OPERATOR, path, "No operator '" + operator + "' taking " + operandCount + " operand(s)");
		theOperator = operator;
	}

	/** @return The operator name */
	public String getOperator() {
		return theOperator;
	}
}
