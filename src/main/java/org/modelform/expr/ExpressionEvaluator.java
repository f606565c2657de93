package org.modelform.expr;

import org.modelform.ModelEvaluationException;
import org.modelform.TypeMismatchException;
import org.modelform.UnknownOperatorException;
import org.modelform.UnresolvedVariableException;
import org.modelform.expr.ops.BinaryOperatorSet;
import org.modelform.expr.ops.BinaryOperatorSet.BinaryOp;
import org.modelform.expr.ops.UnaryOperatorSet;
import org.modelform.expr.ops.UnaryOperatorSet.UnaryOp;
import org.modelform.scope.Scope;
import org.modelform.scope.Selections;

/**
 * Evaluates {@link Expression}s. Operands are evaluated depth-first, left to right, and failures propagate without partial results.
 */
public class ExpressionEvaluator {
	/** An evaluator supporting the closed set of model expression operators */
	public static final ExpressionEvaluator STANDARD = new ExpressionEvaluator(UnaryOperatorSet.STANDARD, BinaryOperatorSet.STANDARD);

	private final UnaryOperatorSet theUnaryOperators;
	private final BinaryOperatorSet theBinaryOperators;

	/**
	 * @param unaryOperators The unary operators to support
	 * @param binaryOperators The binary operators to support
	 */
	public ExpressionEvaluator(UnaryOperatorSet unaryOperators, BinaryOperatorSet binaryOperators) {
		theUnaryOperators = unaryOperators;
		theBinaryOperators = binaryOperators;
	}

	/** @return The unary operators this evaluator supports */
	public UnaryOperatorSet getUnaryOperators() {
		return theUnaryOperators;
	}

	/** @return The binary operators this evaluator supports */
	public BinaryOperatorSet getBinaryOperators() {
		return theBinaryOperators;
	}

	/**
	 * @param expression The expression to evaluate
	 * @param variables The source of values for variable references
	 * @return The value of the expression
	 * @throws ModelEvaluationException If the expression cannot be evaluated
	 */
	public Object evaluate(Expression expression, VariableLookup variables) throws ModelEvaluationException {
		return expression.evaluate(this, variables);
	}

	/**
	 * Evaluates an expression against a resolved scope. Variable references are absolute instance paths, looked up first in the
	 * selections, then in the scope.
	 *
	 * @param expression The expression to evaluate
	 * @param scope The resolved scope
	 * @param selections The user selections, or null for none
	 * @return The value of the expression
	 * @throws ModelEvaluationException If the expression cannot be evaluated
	 */
	public Object evaluate(Expression expression, Scope scope, Selections selections) throws ModelEvaluationException {
		return evaluate(expression, scope.lookup(null, selections));
	}

	/**
	 * @param expression The expression to evaluate, expected to produce a boolean
	 * @param variables The source of values for variable references
	 * @return The boolean value of the expression
	 * @throws ModelEvaluationException If the expression cannot be evaluated or does not produce a boolean
	 */
	public boolean evaluateCondition(Expression expression, VariableLookup variables) throws ModelEvaluationException {
		Object value = evaluate(expression, variables);
		if (!(value instanceof Boolean))
			throw new TypeMismatchException(variables.getContext(), "Condition " + expression + " produced " + Values.describe(value));
		return ((Boolean) value).booleanValue();
	}

	/**
	 * Applies an operator expression's operator to its evaluated operands
	 *
	 * @param expression The operator expression
	 * @param operands The values of the expression's operands
	 * @param variables The variables the operands were evaluated against, for error context
	 * @return The value of the operation
	 * @throws ModelEvaluationException If the operator is unknown or cannot be applied to the operands
	 */
	Object apply(OperatorExpression expression, Object[] operands, VariableLookup variables) throws ModelEvaluationException {
		String operator = expression.getOperator();
		for (Object operand : operands) {
			if (operand == null)
				throw new UnresolvedVariableException(expression.toString(), variables.getContext());
		}
		switch (operands.length) {
		case 1:
			if (!theUnaryOperators.supports(operator))
				break;
			UnaryOp<Object, ?> unary = theUnaryOperators.getOperator(operator, (Class<Object>) operands[0].getClass());
			if (unary == null)
				throw new TypeMismatchException(variables.getContext(),
					"Operator " + operator + " cannot be applied to " + Values.describe(operands[0]) + " in " + expression);
			return unary.apply(operands[0]);
		case 2:
			if (!theBinaryOperators.supports(operator))
				break;
			BinaryOp<Object, Object, ?> binary = theBinaryOperators.getOperator(operator, (Class<Object>) operands[0].getClass(),
				(Class<Object>) operands[1].getClass());
			if (binary == null)
				throw new TypeMismatchException(variables.getContext(), "Operator " + operator + " cannot be applied to "
					+ Values.describe(operands[0]) + " and " + Values.describe(operands[1]) + " in " + expression);
			return binary.apply(operands[0], operands[1]);
		default:
			break;
		}
		throw new UnknownOperatorException(operator, operands.length, variables.getContext());
	}
}
