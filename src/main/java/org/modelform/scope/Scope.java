package org.modelform.scope;

import java.util.Map;

import org.modelform.ModelEvaluationException;
import org.modelform.UnresolvedVariableException;
import org.modelform.dict.Definition;
import org.modelform.expr.VariableLookup;

import com.google.common.collect.ImmutableMap;

/**
 * The resolved values of one evaluation request, by instance path. Only instances that have a value appear. Immutable, and ordered
 * as the instances appear in the instance tree.
 */
public final class Scope {
	private final String theRootType;
	private final ImmutableMap<String, Object> theValues;

	/**
	 * @param rootType The dictionary path of the root class this scope was resolved for
	 * @param values The resolved values by instance path
	 */
	public Scope(String rootType, Map<String, ?> values) {
		theRootType = rootType;
		theValues = ImmutableMap.copyOf(values);
	}

	/** @return The dictionary path of the root class this scope was resolved for */
	public String getRootType() {
		return theRootType;
	}

	/**
	 * @param instancePath The instance path
	 * @return The value at the path, or null if the path has no value
	 */
	public Object get(String instancePath) {
		return theValues.get(instancePath);
	}

	/**
	 * @param instancePath The instance path
	 * @return Whether the path has a value in this scope
	 */
	public boolean contains(String instancePath) {
		return theValues.containsKey(instancePath);
	}

	/** @return The number of valued instance paths in this scope */
	public int size() {
		return theValues.size();
	}

	/** @return The resolved values by instance path */
	public Map<String, Object> asMap() {
		return theValues;
	}

	/**
	 * Creates a lookup for evaluating expressions against this scope. A reference is looked up relative to the context instance
	 * first, then relative to each enclosing instance, then from the root. At each candidate path, a selected value takes precedence
	 * over this scope's.
	 *
	 * @param context The instance path references are relative to, or null for the root
	 * @param selections The user selections, or null for none
	 * @return The lookup
	 */
	public VariableLookup lookup(String context, Selections selections) {
		String ctx = context == null ? "" : context;
		Selections sel = selections == null ? Selections.empty() : selections;
		return new VariableLookup() {
			@Override
			public Object getValue(String reference) throws ModelEvaluationException {
				for (String scope = ctx;; scope = Definition.parentPath(scope)) {
					String candidate = Definition.childPath(scope, reference);
					if (sel.contains(candidate))
						return sel.get(candidate);
					Object value = theValues.get(candidate);
					if (value != null)
						return value;
					if (scope.isEmpty())
						break;
				}
				throw new UnresolvedVariableException(reference, ctx.isEmpty() ? null : ctx);
			}

			@Override
			public String getContext() {
				return ctx.isEmpty() ? null : ctx;
			}
		};
	}

	@Override
	public int hashCode() {
		return theValues.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Scope))
			return false;
		Scope other = (Scope) obj;
		return theRootType.equals(other.theRootType) && theValues.equals(other.theValues);
	}

	@Override
	public String toString() {
		return theValues.toString();
	}
}
