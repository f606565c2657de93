package org.modelform.expr;

import java.util.Collections;
import java.util.List;

import org.modelform.ModelEvaluationException;

/** An expression whose value is that of another instance path, resolved against the scope at evaluation time */
public final class VariableReference implements Expression {
	private final String theName;

	/** @param name The dotted instance path, relative to the evaluation context */
	public VariableReference(String name) {
		if (name == null || name.isEmpty())
			throw new IllegalArgumentException("A variable reference needs a name");
		theName = name;
	}

	/** @return The dotted instance path, relative to the evaluation context */
	public String getName() {
		return theName;
	}

	@Override
	public List<Expression> getComponents() {
		return Collections.emptyList();
	}

	@Override
	public boolean isConstant() {
		return false;
	}

	@Override
	public Object evaluate(ExpressionEvaluator evaluator, VariableLookup variables) throws ModelEvaluationException {
		return variables.getValue(theName);
	}

	@Override
	public int hashCode() {
		return theName.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof VariableReference && theName.equals(((VariableReference) obj).theName);
	}

	@Override
	public String toString() {
		return theName;
	}
}
