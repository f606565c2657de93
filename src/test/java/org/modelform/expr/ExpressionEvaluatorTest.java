package org.modelform.expr;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.modelform.ErrorKind;
import org.modelform.ModelEvaluationException;
import org.modelform.TypeMismatchException;
import org.modelform.UnknownOperatorException;
import org.modelform.UnresolvedVariableException;

/** Tests {@link ExpressionEvaluator} */
public class ExpressionEvaluatorTest {
	private Map<String, Object> theVariables;
	private VariableLookup theLookup;

	/** Sets up the test */
	@Before
	public void setup() {
		theVariables = new HashMap<>();
		theVariables.put("flag", true);
		theVariables.put("count", 3);
		theVariables.put("ratio", 0.5);
		theVariables.put("name", "abc");
		theLookup = reference -> {
			Object value = theVariables.get(reference);
			if (value == null)
				throw new UnresolvedVariableException(reference, null);
			return value;
		};
	}

	private Object eval(Expression expression) throws ModelEvaluationException {
		return ExpressionEvaluator.STANDARD.evaluate(expression, theLookup);
	}

	private static Expression lit(Object value) {
		return Literal.of(value);
	}

	private static Expression ref(String name) {
		return new VariableReference(name);
	}

	/**
	 * Tests the comparison operators on each kind of value
	 *
	 * @throws ModelEvaluationException If evaluation fails
	 */
	@Test
	public void testComparisons() throws ModelEvaluationException {
		Assert.assertEquals(true, eval(OperatorExpression.binary("==", ref("count"), lit(3))));
		Assert.assertEquals(false, eval(OperatorExpression.binary("!=", ref("count"), lit(3))));
		Assert.assertEquals(true, eval(OperatorExpression.binary("<", ref("ratio"), ref("count"))));
		Assert.assertEquals(true, eval(OperatorExpression.binary(">=", lit(3.0), ref("count"))));
		Assert.assertEquals(true, eval(OperatorExpression.binary("<=", ref("name"), lit("abd"))));
		Assert.assertEquals(true, eval(OperatorExpression.binary("==", ref("flag"), lit(true))));
		Assert.assertEquals(false, eval(OperatorExpression.binary(">", ref("name"), lit("abc"))));
	}

	/**
	 * Tests boolean logic, nested operands included
	 *
	 * @throws ModelEvaluationException If evaluation fails
	 */
	@Test
	public void testLogic() throws ModelEvaluationException {
		Expression countIsThree = OperatorExpression.binary("==", ref("count"), lit(3));
		Assert.assertEquals(true, eval(OperatorExpression.binary("&&", ref("flag"), countIsThree)));
		Assert.assertEquals(false, eval(OperatorExpression.unary("!", ref("flag"))));
		Assert.assertEquals(true, eval(OperatorExpression.binary("||", lit(false), OperatorExpression.unary("!", lit(false)))));
		Assert.assertTrue(ExpressionEvaluator.STANDARD.evaluateCondition(countIsThree, theLookup));
	}

	/** Tests that comparing a string with a number fails with a type mismatch */
	@Test
	public void testTypeMismatch() {
		try {
			eval(OperatorExpression.binary("==", lit("abc"), lit(3)));
			Assert.fail("Expected a type mismatch");
		} catch (ModelEvaluationException e) {
			Assert.assertTrue(e instanceof TypeMismatchException);
			Assert.assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
		}
		try {
			eval(OperatorExpression.unary("!", lit(1)));
			Assert.fail("Expected a type mismatch");
		} catch (ModelEvaluationException e) {
			Assert.assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
		}
		try {
			ExpressionEvaluator.STANDARD.evaluateCondition(ref("name"), theLookup);
			Assert.fail("Expected a non-boolean condition to fail");
		} catch (ModelEvaluationException e) {
			Assert.assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
		}
	}

	/** Tests that operators outside the closed set, or with the wrong number of operands, fail */
	@Test
	public void testUnknownOperator() {
		try {
			eval(OperatorExpression.binary("+", lit(1), lit(2)));
			Assert.fail("Expected an unknown operator");
		} catch (ModelEvaluationException e) {
			Assert.assertTrue(e instanceof UnknownOperatorException);
		}
		try {
			eval(new OperatorExpression("==", Arrays.asList(lit(1), lit(1), lit(1))));
			Assert.fail("Expected an unknown operator for 3 operands");
		} catch (ModelEvaluationException e) {
			Assert.assertEquals(ErrorKind.UNKNOWN_OPERATOR, e.getKind());
		}
		try {
			eval(OperatorExpression.unary("==", lit(true)));
			Assert.fail("Expected an unknown operator for 1 operand");
		} catch (ModelEvaluationException e) {
			Assert.assertEquals(ErrorKind.UNKNOWN_OPERATOR, e.getKind());
		}
	}

	/** Tests that both operands of a logical operator are evaluated, so a bad right operand fails even when the left decides */
	@Test
	public void testNoShortCircuit() {
		try {
			eval(OperatorExpression.binary("||", lit(true), ref("missing")));
			Assert.fail("Expected the right operand to be evaluated");
		} catch (ModelEvaluationException e) {
			Assert.assertEquals(ErrorKind.UNRESOLVED_VARIABLE, e.getKind());
			Assert.assertEquals("missing", ((UnresolvedVariableException) e).getReference());
		}
	}

	/** Tests that operands are evaluated left to right, the first failure propagating */
	@Test
	public void testLeftToRight() {
		try {
			eval(OperatorExpression.binary("&&", OperatorExpression.binary("==", lit("a"), lit(1)), ref("missing")));
			Assert.fail("Expected the left operand to fail");
		} catch (ModelEvaluationException e) {
			Assert.assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
		}
	}
}
