package org.modelform.expr;

import java.util.List;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Parses modelica-flavored expression text (<code>not</code>, <code>and</code>, <code>or</code>, <code>&lt;&gt;</code> and their
 * C-style equivalents) into fully nested {@link Expression} trees
 */
public class AntlrExpressionParser implements ExpressionParser {
	/** Operator names as they appear in {@link OperatorExpression}s, by their alternate spellings in text */
	private static final String NOT = "!";
	private static final String AND = "&&";
	private static final String OR = "||";
	private static final String NOT_EQUAL = "!=";

	@Override
	public Expression parse(String text) throws ExpressionParseException {
		if (text == null || text.trim().isEmpty())
			throw new ExpressionParseException(0, 0, String.valueOf(text), "Empty expression");
		ModelExpressionLexer lexer = new ModelExpressionLexer(CharStreams.fromString(text));
		lexer.removeErrorListeners();
		lexer.addErrorListener(ThrowingErrorListener.INSTANCE);
		ModelExpressionParser parser = new ModelExpressionParser(new CommonTokenStream(lexer));
		parser.removeErrorListeners();
		parser.addErrorListener(ThrowingErrorListener.INSTANCE);
		ModelExpressionParser.ExpressionFullContext result;
		try {
			result = parser.expressionFull();
		} catch (SyntaxError e) {
			throw new ExpressionParseException(e.theOffset, e.theEndIndex, text, e.getMessage());
		}
		return new TreeConverter().visit(result);
	}

	private static class TreeConverter extends ModelExpressionBaseVisitor<Expression> {
		TreeConverter() {
		}

		@Override
		public Expression visitExpressionFull(ModelExpressionParser.ExpressionFullContext ctx) {
			return visit(ctx.logicalExpression());
		}

		@Override
		public Expression visitLogicalExpression(ModelExpressionParser.LogicalExpressionContext ctx) {
			List<ModelExpressionParser.LogicalTermContext> terms = ctx.logicalTerm();
			Expression result = visit(terms.get(0));
			for (int i = 1; i < terms.size(); i++)
				result = OperatorExpression.binary(OR, result, visit(terms.get(i)));
			return result;
		}

		@Override
		public Expression visitLogicalTerm(ModelExpressionParser.LogicalTermContext ctx) {
			List<ModelExpressionParser.LogicalFactorContext> factors = ctx.logicalFactor();
			Expression result = visit(factors.get(0));
			for (int i = 1; i < factors.size(); i++)
				result = OperatorExpression.binary(AND, result, visit(factors.get(i)));
			return result;
		}

		@Override
		public Expression visitLogicalFactor(ModelExpressionParser.LogicalFactorContext ctx) {
			if (ctx.notOp() != null)
				return OperatorExpression.unary(NOT, visit(ctx.logicalFactor()));
			return visit(ctx.relation());
		}

		@Override
		public Expression visitRelation(ModelExpressionParser.RelationContext ctx) {
			List<ModelExpressionParser.PrimaryContext> primaries = ctx.primary();
			Expression left = visit(primaries.get(0));
			if (ctx.relOp() == null)
				return left;
			String op = ctx.relOp().getText();
			if ("<>".equals(op))
				op = NOT_EQUAL;
			return OperatorExpression.binary(op, left, visit(primaries.get(1)));
		}

		@Override
		public Expression visitPrimary(ModelExpressionParser.PrimaryContext ctx) {
			if (ctx.literal() != null)
				return visit(ctx.literal());
			else if (ctx.name() != null)
				return visit(ctx.name());
			else
				return visit(ctx.logicalExpression());
		}

		@Override
		public Expression visitLiteral(ModelExpressionParser.LiteralContext ctx) {
			if (ctx.TRUE() != null)
				return Literal.TRUE;
			else if (ctx.FALSE() != null)
				return Literal.FALSE;
			else if (ctx.STRING() != null)
				return Literal.of(Values.unquote(ctx.STRING().getText()));
			TerminalNode number = ctx.INTEGER() != null ? ctx.INTEGER() : ctx.REAL();
			String text = number.getText();
			if (ctx.MINUS() != null)
				text = "-" + text;
			return Literal.of(Values.parseNumber(text));
		}

		@Override
		public Expression visitName(ModelExpressionParser.NameContext ctx) {
			StringBuilder name = new StringBuilder();
			for (TerminalNode ident : ctx.IDENT()) {
				if (name.length() > 0)
					name.append('.');
				name.append(ident.getText());
			}
			return new VariableReference(name.toString());
		}
	}

	private static class ThrowingErrorListener extends BaseErrorListener {
		static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

		@Override
		public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg,
			RecognitionException e) {
			int start = charPositionInLine;
			int end = charPositionInLine + 1;
			if (offendingSymbol instanceof Token) {
				Token token = (Token) offendingSymbol;
				if (token.getStartIndex() >= 0) {
					start = token.getStartIndex();
					end = token.getStopIndex() + 1;
				}
			}
			throw new SyntaxError(start, end, msg);
		}
	}

	/** Unwinds the ANTLR recognizer at the first syntax error */
	private static class SyntaxError extends RuntimeException {
		final int theOffset;
		final int theEndIndex;

		SyntaxError(int offset, int endIndex, String message) {
			super(message);
			theOffset = offset;
			theEndIndex = endIndex;
		}
	}
}
