package org.modelform.expr;

import org.modelform.ModelEvaluationException;

/** Supplies values for {@link VariableReference}s during evaluation */
public interface VariableLookup {
	/**
	 * @param reference The dotted variable reference, relative to this lookup's context
	 * @return The value of the variable, never null
	 * @throws ModelEvaluationException If the variable cannot be resolved
	 */
	Object getValue(String reference) throws ModelEvaluationException;

	/** @return The instance path against which references are resolved, or null for the root */
	default String getContext() {
		return null;
	}
}
