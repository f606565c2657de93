package org.modelform.expr.ops;

import org.junit.Assert;
import org.junit.Test;
import org.modelform.expr.ops.BinaryOperatorSet.BinaryOp;

/** Tests {@link BinaryOperatorSet} and {@link UnaryOperatorSet} */
public class BinaryOperatorSetTest {
	/** Tests that the standard set supports exactly the closed set of binary operators */
	@Test
	public void testStandardOperators() {
		for (String op : new String[] { "==", "!=", "<", "<=", ">", ">=", "&&", "||" })
			Assert.assertTrue(op, BinaryOperatorSet.STANDARD.supports(op));
		Assert.assertEquals(8, BinaryOperatorSet.STANDARD.getOperators().size());
		Assert.assertFalse(BinaryOperatorSet.STANDARD.supports("+"));
		Assert.assertTrue(UnaryOperatorSet.STANDARD.supports("!"));
		Assert.assertEquals(1, UnaryOperatorSet.STANDARD.getOperators().size());
	}

	/** Tests that integers and reals compare with one another */
	@Test
	public void testMixedNumericComparison() {
		BinaryOp<Integer, Double, ?> lt = BinaryOperatorSet.STANDARD.getOperator("<", Integer.class, Double.class);
		Assert.assertNotNull(lt);
		Assert.assertEquals(Boolean.TRUE, lt.apply(2, 2.5));
		BinaryOp<Double, Integer, ?> eq = BinaryOperatorSet.STANDARD.getOperator("==", Double.class, Integer.class);
		Assert.assertEquals(Boolean.TRUE, eq.apply(3.0, 3));
	}

	/** Tests that operators have no entries for operands of different kinds */
	@Test
	public void testNoCrossKindOperators() {
		Assert.assertNull(BinaryOperatorSet.STANDARD.getOperator("==", String.class, Integer.class));
		Assert.assertNull(BinaryOperatorSet.STANDARD.getOperator("&&", Boolean.class, String.class));
		Assert.assertNull(UnaryOperatorSet.STANDARD.getOperator("!", Integer.class));
	}

	/** Tests string and boolean ordering */
	@Test
	public void testOrdering() {
		Assert.assertEquals(Boolean.TRUE, BinaryOperatorSet.STANDARD.getOperator("<", String.class, String.class).apply("abc", "abd"));
		Assert.assertEquals(Boolean.TRUE, BinaryOperatorSet.STANDARD.getOperator(">", Boolean.class, Boolean.class).apply(true, false));
		Assert.assertEquals(Boolean.FALSE, BinaryOperatorSet.STANDARD.getOperator("||", Boolean.class, Boolean.class).apply(false, false));
	}

	/** Tests {@link BinaryOperatorSet#copy()} with an added operator */
	@Test
	public void testCopy() {
		BinaryOperatorSet extended = BinaryOperatorSet.STANDARD.copy()//
			.with("max", Integer.class, Integer.class, Integer.class, (a, b) -> Math.max(a, b))//
			.build();
		Assert.assertTrue(extended.supports("max"));
		Assert.assertTrue(extended.supports("=="));
		Assert.assertFalse(BinaryOperatorSet.STANDARD.supports("max"));
		Assert.assertEquals(7, extended.getOperator("max", Integer.class, Integer.class).apply(3, 7));
	}
}
