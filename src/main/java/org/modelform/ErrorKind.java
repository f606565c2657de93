package org.modelform;

/** The closed set of problems that loading a model or resolving its scope may encounter */
public enum ErrorKind {
	/** A type reference could not be found by the type resolver */
	TYPE_NOT_FOUND(true),
	/** An annotation expression could not be parsed. Recovered by substituting a default. */
	MALFORMED_ANNOTATION(false),
	/** A definition's children refer to a path that is not in the type dictionary */
	DANGLING_REFERENCE(true),
	/** Class definition composition refers back to itself */
	CYCLIC_DEFINITION(true),
	/** Value resolution depends on itself */
	CYCLIC_REFERENCE(false),
	/** An expression uses an operator outside the supported set, or with the wrong number of operands */
	UNKNOWN_OPERATOR(false),
	/** An operator or a declared type was applied to values of incompatible kinds */
	TYPE_MISMATCH(false),
	/** A variable reference does not name any resolvable instance path */
	UNRESOLVED_VARIABLE(false),
	/** A resolution visited more nodes than its configured budget */
	RESOLUTION_BUDGET_EXCEEDED(false);

	private final boolean isStructural;

	private ErrorKind(boolean structural) {
		isStructural = structural;
	}

	/**
	 * @return Whether this kind of problem indicates an inconsistent source model, aborting the model's load. Other kinds only affect a
	 *         single resolution request (or, for {@link #MALFORMED_ANNOTATION}, nothing at all).
	 */
	public boolean isStructural() {
		return isStructural;
	}
}
