package org.modelform.expr;

import java.text.ParseException;

/** Thrown from {@link ExpressionParser#parse(String)} and {@link JsonExpressionReader} when expression source cannot be understood */
public class ExpressionParseException extends ParseException {
	private final int theEndIndex;
	private final String theText;

	/**
	 * @param errorOffset The start index of the error
	 * @param endIndex The end index of the error
	 * @param text The text content that is the source of the error
	 * @param message The message for the exception
	 */
	public ExpressionParseException(int errorOffset, int endIndex, String text, String message) {
		super(message + " ( " + text + " ) at position " + errorOffset, errorOffset);
		theEndIndex = endIndex;
		theText = text;
	}

	/** @return The start index of the error */
	@Override
	public int getErrorOffset() {
		return super.getErrorOffset();
	}

	/** @return The end index of the error */
	public int getEndIndex() {
		return theEndIndex;
	}

	/** @return The text content that is the source of the error */
	public String getText() {
		return theText;
	}
}
