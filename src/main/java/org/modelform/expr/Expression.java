package org.modelform.expr;

import java.util.List;

import org.modelform.ModelEvaluationException;

/**
 * A node of the closed expression language used for default values and enablement predicates. Expressions arrive fully nested from the
 * model source; evaluation holds no precedence rules of its own.
 */
public interface Expression {
	/** @return The expressions this expression is composed of, in evaluation order */
	List<Expression> getComponents();

	/**
	 * @param evaluator The evaluator supplying the operator implementations
	 * @param variables The source of values for variable references
	 * @return The value of this expression
	 * @throws ModelEvaluationException If the expression cannot be evaluated
	 */
	Object evaluate(ExpressionEvaluator evaluator, VariableLookup variables) throws ModelEvaluationException;

	/**
	 * @return Whether this expression contains no {@link VariableReference}s, so that its value does not depend on any scope
	 */
	default boolean isConstant() {
		for (Expression component : getComponents()) {
			if (!component.isConstant())
				return false;
		}
		return true;
	}

	/** @return The expression in the text syntax that would parse to it */
	@Override
	String toString();
}
