package org.modelform.tree;

import java.util.Objects;

import org.modelform.expr.Expression;

/** A value supplied at an instantiation site, together with the instance its expression is evaluated in */
public final class InstanceOverride {
	private final Expression theExpression;
	private final String theContext;

	/**
	 * @param expression The expression of the supplied value
	 * @param context The instance path of the instance containing the instantiation site, or the empty string for the root
	 */
	public InstanceOverride(Expression expression, String context) {
		theExpression = Objects.requireNonNull(expression, "expression");
		theContext = context == null ? "" : context;
	}

	/** @return The expression of the supplied value */
	public Expression getExpression() {
		return theExpression;
	}

	/** @return The instance path of the instance containing the instantiation site, or the empty string for the root */
	public String getContext() {
		return theContext;
	}

	@Override
	public int hashCode() {
		return Objects.hash(theExpression, theContext);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof InstanceOverride))
			return false;
		InstanceOverride other = (InstanceOverride) obj;
		return theExpression.equals(other.theExpression) && theContext.equals(other.theContext);
	}

	@Override
	public String toString() {
		return theExpression + (theContext.isEmpty() ? "" : " (in " + theContext + ")");
	}
}
