package org.modelform.expr;

import java.util.List;

import org.modelform.ModelEvaluationException;

import com.google.common.collect.ImmutableList;

/** An operator applied to an ordered sequence of operands */
public final class OperatorExpression implements Expression {
	private final String theOperator;
	private final List<Expression> theOperands;

	/**
	 * @param operator The operator name, e.g. <code>==</code> or <code>!</code>. Unsupported names are accepted here and fail on
	 *        evaluation.
	 * @param operands The operands for the operator
	 */
	public OperatorExpression(String operator, List<? extends Expression> operands) {
		if (operator == null || operator.isEmpty())
			throw new IllegalArgumentException("An operator expression needs an operator");
		theOperator = operator;
		theOperands = ImmutableList.copyOf(operands);
	}

	/**
	 * @param operator The binary operator name
	 * @param left The left operand
	 * @param right The right operand
	 * @return The binary expression
	 */
	public static OperatorExpression binary(String operator, Expression left, Expression right) {
		return new OperatorExpression(operator, ImmutableList.of(left, right));
	}

	/**
	 * @param operator The unary operator name
	 * @param operand The operand
	 * @return The unary expression
	 */
	public static OperatorExpression unary(String operator, Expression operand) {
		return new OperatorExpression(operator, ImmutableList.of(operand));
	}

	/** @return The operator name */
	public String getOperator() {
		return theOperator;
	}

	/** @return The operands for the operator */
	public List<Expression> getOperands() {
		return theOperands;
	}

	@Override
	public List<Expression> getComponents() {
		return theOperands;
	}

	@Override
	public Object evaluate(ExpressionEvaluator evaluator, VariableLookup variables) throws ModelEvaluationException {
		// Operands are side-effect free, so all are evaluated, left to right, before the operator is applied
		Object[] values = new Object[theOperands.size()];
		for (int i = 0; i < values.length; i++)
			values[i] = theOperands.get(i).evaluate(evaluator, variables);
		return evaluator.apply(this, values, variables);
	}

	@Override
	public int hashCode() {
		return theOperator.hashCode() * 31 + theOperands.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof OperatorExpression))
			return false;
		OperatorExpression other = (OperatorExpression) obj;
		return theOperator.equals(other.theOperator) && theOperands.equals(other.theOperands);
	}

	@Override
	public String toString() {
		if (theOperands.size() == 1)
			return theOperator + wrap(theOperands.get(0));
		StringBuilder str = new StringBuilder();
		for (int i = 0; i < theOperands.size(); i++) {
			if (i > 0)
				str.append(' ').append(theOperator).append(' ');
			str.append(wrap(theOperands.get(i)));
		}
		return str.toString();
	}

	private static String wrap(Expression operand) {
		if (operand instanceof OperatorExpression)
			return "(" + operand + ")";
		return operand.toString();
	}
}
