package org.modelform.expr;

/** An ExpressionParser interprets text into {@link Expression} objects */
public interface ExpressionParser {
	/**
	 * @param text The text to interpret
	 * @return The {@link Expression} represented by the text
	 * @throws ExpressionParseException If the expression cannot be parsed
	 */
	Expression parse(String text) throws ExpressionParseException;
}
