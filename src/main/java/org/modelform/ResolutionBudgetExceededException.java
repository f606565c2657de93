package org.modelform;

/** Thrown when a scope resolution visits more nodes than it is allowed to */
public class ResolutionBudgetExceededException extends ModelEvaluationException {
	private final int theBudget;

	/**
	 * @param budget The maximum number of node visits allowed
	 * @param path The instance path being visited when the budget ran out
	 */
	public ResolutionBudgetExceededException(int budget, String path) {
		super(ErrorKind.RESOLUTION_BUDGET_EXCEEDED, path, "Resolution exceeded its budget of " + budget + " node visits");
		theBudget = budget;
	}

	/** @return The maximum number of node visits that was allowed */
	public int getBudget() {
		return theBudget;
	}
}
