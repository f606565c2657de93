package org.modelform.expr;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;

/** Utilities for the values an expression may produce: {@link Boolean}, {@link Integer}, {@link Double} and {@link String} */
public class Values {
	/** The kinds of values that may be compared with one another */
	public enum ValueKind {
		/** {@link Boolean} values */
		BOOLEAN,
		/** {@link Integer} and {@link Double} values */
		NUMERIC,
		/** {@link String} values */
		STRING
	}

	private Values() {
	}

	/**
	 * @param value The value to inspect
	 * @return The kind of the value, or null if the value is null or not of a supported type
	 */
	public static ValueKind kindOf(Object value) {
		if (value instanceof Boolean)
			return ValueKind.BOOLEAN;
		else if (value instanceof Integer || value instanceof Long || value instanceof Double || value instanceof Float
			|| value instanceof Short || value instanceof Byte)
			return ValueKind.NUMERIC;
		else if (value instanceof String)
			return ValueKind.STRING;
		else
			return null;
	}

	/**
	 * @param value A value of a supported kind
	 * @return The value with any numeric type narrowed or widened to {@link Integer} or {@link Double}
	 */
	public static Object normalize(Object value) {
		if (value instanceof Integer || value instanceof Double || !(value instanceof Number))
			return value;
		else if (value instanceof Float)
			return Double.valueOf(((Float) value).doubleValue());
		long l = ((Number) value).longValue();
		if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE)
			return Integer.valueOf((int) l);
		return Double.valueOf(l);
	}

	/**
	 * @param text The text of a number
	 * @return An {@link Integer} if the text is integral and fits, otherwise a {@link Double}
	 * @throws NumberFormatException If the text is not a number
	 */
	public static Object parseNumber(String text) {
		String trimmed = text.trim();
		boolean integral = true;
		for (int i = 0; i < trimmed.length() && integral; i++) {
			char c = trimmed.charAt(i);
			if (c == '.' || c == 'e' || c == 'E')
				integral = false;
		}
		if (integral) {
			try {
				return Integer.valueOf(trimmed);
			} catch (NumberFormatException e) {
				// Too large for an int, represented as a real below
			}
		}
		return Double.valueOf(trimmed);
	}

	/**
	 * @param left The first number
	 * @param right The second number
	 * @return The comparison of the two numbers, exact for two integers
	 */
	public static int compareNumbers(Number left, Number right) {
		if (left instanceof Integer && right instanceof Integer)
			return Integer.compare(left.intValue(), right.intValue());
		return Double.compare(left.doubleValue(), right.doubleValue());
	}

	/**
	 * @param json The JSON primitive to convert
	 * @return The value represented by the JSON
	 * @throws IllegalArgumentException If the JSON is not a primitive
	 */
	public static Object fromJson(JsonElement json) {
		if (json == null || !json.isJsonPrimitive())
			throw new IllegalArgumentException("Not a primitive value: " + json);
		JsonPrimitive prim = json.getAsJsonPrimitive();
		if (prim.isBoolean())
			return Boolean.valueOf(prim.getAsBoolean());
		else if (prim.isNumber())
			return parseNumber(prim.getAsString());
		else
			return prim.getAsString();
	}

	/**
	 * @param value The value to convert
	 * @return The JSON representation of the value
	 */
	public static JsonElement toJson(Object value) {
		if (value == null)
			return JsonNull.INSTANCE;
		else if (value instanceof Boolean)
			return new JsonPrimitive((Boolean) value);
		else if (value instanceof Number)
			return new JsonPrimitive((Number) value);
		else
			return new JsonPrimitive(value.toString());
	}

	/**
	 * @param value The value to print
	 * @return The value as it would be written in expression text
	 */
	public static String toText(Object value) {
		if (value instanceof String)
			return quote((String) value);
		return String.valueOf(value);
	}

	/**
	 * @param value The value to describe
	 * @return A description of the value and its kind, for error messages
	 */
	public static String describe(Object value) {
		ValueKind kind = kindOf(value);
		return (kind == null ? (value == null ? "null" : value.getClass().getSimpleName()) : kind.name().toLowerCase()) + " "
			+ toText(value);
	}

	/**
	 * @param text The string content
	 * @return The string literal representing the content
	 */
	public static String quote(String text) {
		StringBuilder str = new StringBuilder(text.length() + 2).append('"');
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
			case '"':
			case '\\':
				str.append('\\').append(c);
				break;
			case '\n':
				str.append("\\n");
				break;
			case '\t':
				str.append("\\t");
				break;
			default:
				str.append(c);
			}
		}
		return str.append('"').toString();
	}

	/**
	 * @param literal A string literal, including its quotes
	 * @return The string content of the literal
	 */
	public static String unquote(String literal) {
		StringBuilder str = new StringBuilder(literal.length());
		int end = literal.length() - 1;
		for (int i = 1; i < end; i++) {
			char c = literal.charAt(i);
			if (c == '\\' && i + 1 < end) {
				c = literal.charAt(++i);
				switch (c) {
				case 'n':
					str.append('\n');
					break;
				case 't':
					str.append('\t');
					break;
				case 'r':
					str.append('\r');
					break;
				default:
					str.append(c);
				}
			} else
				str.append(c);
		}
		return str.toString();
	}
}
