package org.modelform.expr;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** An expression whose value is a constant Boolean, Integer, Real or String */
public final class Literal implements Expression {
	/** The literal <code>true</code> */
	public static final Literal TRUE = new Literal(Boolean.TRUE);
	/** The literal <code>false</code> */
	public static final Literal FALSE = new Literal(Boolean.FALSE);

	private final Object theValue;

	private Literal(Object value) {
		theValue = value;
	}

	/**
	 * @param value The value for the literal
	 * @return The literal expression
	 * @throws IllegalArgumentException If the value is not of a supported kind
	 */
	public static Literal of(Object value) {
		if (value instanceof Boolean)
			return ((Boolean) value).booleanValue() ? TRUE : FALSE;
		if (Values.kindOf(value) == null)
			throw new IllegalArgumentException("Unsupported literal value: " + value);
		return new Literal(Values.normalize(value));
	}

	/** @return The constant value */
	public Object getValue() {
		return theValue;
	}

	@Override
	public List<Expression> getComponents() {
		return Collections.emptyList();
	}

	@Override
	public Object evaluate(ExpressionEvaluator evaluator, VariableLookup variables) {
		return theValue;
	}

	@Override
	public int hashCode() {
		return theValue.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Literal && Objects.equals(theValue, ((Literal) obj).theValue);
	}

	@Override
	public String toString() {
		return Values.toText(theValue);
	}
}
