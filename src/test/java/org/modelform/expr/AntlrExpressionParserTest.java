package org.modelform.expr;

import org.junit.Assert;
import org.junit.Test;

/** Tests {@link AntlrExpressionParser} */
public class AntlrExpressionParserTest {
	private final ExpressionParser theParser = new AntlrExpressionParser();

	private Expression parse(String text) {
		try {
			return theParser.parse(text);
		} catch (ExpressionParseException e) {
			System.err.println(text);
			for (int i = 0; i < e.getErrorOffset(); i++)
				System.err.print(' ');
			System.err.println("^");
			throw new AssertionError("Parsing failed", e);
		}
	}

	/** Tests literal parsing */
	@Test
	public void testLiterals() {
		Assert.assertEquals(Literal.TRUE, parse("true"));
		Assert.assertEquals(Literal.FALSE, parse("false"));
		Assert.assertEquals(Literal.of(42), parse("42"));
		Assert.assertEquals(Literal.of(-3), parse("-3"));
		Assert.assertEquals(Literal.of(2.5), parse("2.5"));
		Assert.assertEquals(Literal.of(1e3), parse("1e3"));
		Assert.assertEquals(Literal.of("World"), parse("\"World\""));
		Assert.assertEquals(Literal.of("say \"hi\""), parse("\"say \\\"hi\\\"\""));
	}

	/** Tests dotted variable references */
	@Test
	public void testNames() {
		Assert.assertEquals(new VariableReference("subModel.nestedBoolean"), parse("subModel.nestedBoolean"));
	}

	/** Tests that keyword and symbolic operators produce the same nested trees */
	@Test
	public void testOperatorSpellings() {
		Expression expected = OperatorExpression.binary("||", //
			OperatorExpression.binary("&&", new VariableReference("a"), OperatorExpression.unary("!", new VariableReference("b"))), //
			OperatorExpression.binary("!=", new VariableReference("c"), Literal.of(1)));
		Assert.assertEquals(expected, parse("a and not b or c <> 1"));
		Assert.assertEquals(expected, parse("a && !b || c != 1"));
	}

	/** Tests that and binds tighter than or, and that parentheses override it */
	@Test
	public void testNesting() {
		Expression a = new VariableReference("a");
		Expression b = new VariableReference("b");
		Expression c = new VariableReference("c");
		Assert.assertEquals(OperatorExpression.binary("||", a, OperatorExpression.binary("&&", b, c)), parse("a or b and c"));
		Assert.assertEquals(OperatorExpression.binary("&&", OperatorExpression.binary("||", a, b), c), parse("(a or b) and c"));
		Assert.assertEquals(OperatorExpression.binary("&&", OperatorExpression.binary("&&", a, b), c), parse("a and b and c"));
		Assert.assertEquals(OperatorExpression.binary("==", new VariableReference("allow_hello"), Literal.TRUE),
			parse("allow_hello == true"));
	}

	/** Tests that bad text fails with an offset */
	@Test
	public void testSyntaxErrors() {
		for (String bad : new String[] { "", "a ==", "a < b < c", "(a", "a == == b", "1 +" }) {
			try {
				theParser.parse(bad);
				Assert.fail("Expected a parse failure for " + bad);
			} catch (ExpressionParseException e) {
				Assert.assertEquals(bad, e.getText());
				Assert.assertTrue(e.getErrorOffset() >= 0);
			}
		}
	}
}
