package org.modelform.scope;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.modelform.CyclicReferenceException;
import org.modelform.ModelEvaluationException;
import org.modelform.ModelFormException;
import org.modelform.ResolutionBudgetExceededException;
import org.modelform.UnresolvedVariableException;
import org.modelform.dict.ComponentDefinition;
import org.modelform.dict.DataType;
import org.modelform.dict.Definition;
import org.modelform.dict.TypeDictionary;
import org.modelform.expr.Expression;
import org.modelform.expr.ExpressionEvaluator;
import org.modelform.expr.VariableLookup;
import org.modelform.tree.InstanceNode;
import org.modelform.tree.InstanceOverride;
import org.modelform.tree.InstanceTree;
import org.modelform.tree.TreeBuilder;

/**
 * Resolves every instance reachable from a root class to a concrete value, producing a {@link Scope}.
 * <p>
 * The value of an instance is, in order of precedence: its {@link Selections selected} value, the value supplied for it at an
 * enclosing instantiation site, or the value its component is declared with. Values that are expressions are evaluated, and any
 * instance they refer to is resolved first regardless of where it appears in the model. Resolution that comes back to an instance
 * already being resolved fails with a {@link CyclicReferenceException}.
 * Resolving more instances in one request than the node visit budget allows fails with a
 * {@link ResolutionBudgetExceededException}.
 * </p>
 * <p>
 * A resolver holds no state between requests: each call is independent, and a resolver may serve concurrent requests.
 * </p>
 */
public class ScopeResolver {
	private static final Logger LOGGER = LogManager.getLogger(ScopeResolver.class);

	/** The default maximum number of node visits in one resolution. Each instance counts once, when it is first resolved. */
	public static final int DEFAULT_NODE_VISIT_BUDGET = 100_000;

	private final TypeDictionary theDictionary;
	private final ExpressionEvaluator theEvaluator;
	private final int theNodeVisitBudget;

	/**
	 * @param dictionary The dictionary to resolve against
	 * @param evaluator The evaluator for value expressions
	 * @param nodeVisitBudget The maximum number of node visits in one resolution
	 */
	public ScopeResolver(TypeDictionary dictionary, ExpressionEvaluator evaluator, int nodeVisitBudget) {
		if (nodeVisitBudget <= 0)
			throw new IllegalArgumentException("Node visit budget must be positive, not " + nodeVisitBudget);
		theDictionary = dictionary;
		theEvaluator = evaluator;
		theNodeVisitBudget = nodeVisitBudget;
	}

	/** @param dictionary The dictionary to resolve against */
	public ScopeResolver(TypeDictionary dictionary) {
		this(dictionary, ExpressionEvaluator.STANDARD, DEFAULT_NODE_VISIT_BUDGET);
	}

	/** @return The dictionary this resolver resolves against */
	public TypeDictionary getDictionary() {
		return theDictionary;
	}

	/** @return The evaluator for value expressions */
	public ExpressionEvaluator getEvaluator() {
		return theEvaluator;
	}

	/** @return The maximum number of node visits in one resolution */
	public int getNodeVisitBudget() {
		return theNodeVisitBudget;
	}

	/**
	 * @param rootType The dictionary path of the root class
	 * @param selections The user selections, or null for none
	 * @return The resolved scope
	 * @throws ModelFormException If the root's instance tree is invalid or the resolution fails
	 */
	public Scope resolve(String rootType, Selections selections) throws ModelFormException {
		return resolve(TreeBuilder.build(rootType, theDictionary), selections);
	}

	/**
	 * @param tree The instance tree to resolve
	 * @param selections The user selections, or null for none
	 * @return The resolved scope
	 * @throws ModelEvaluationException If the resolution fails
	 */
	public Scope resolve(InstanceTree tree, Selections selections) throws ModelEvaluationException {
		Resolution resolution = new Resolution(tree, selections == null ? Selections.empty() : selections);
		for (InstanceNode node : tree.getNodes())
			resolution.resolve(node);
		Map<String, Object> values = new LinkedHashMap<>();
		for (InstanceNode node : tree.getNodes()) {
			Object value = resolution.theValues.get(node.getInstancePath());
			if (value != null)
				values.put(node.getInstancePath(), value);
		}
		LOGGER.debug("Resolved {} values of {} in {} node visits", values.size(), tree.getRootType(), resolution.theVisits);
		return new Scope(tree.getRootType(), values);
	}

	/**
	 * @param scope The resolved scope
	 * @param instancePath The instance path to get the value of
	 * @return The value at the path
	 * @throws UnresolvedVariableException If the path has no value in the scope
	 */
	public Object getValue(Scope scope, String instancePath) throws UnresolvedVariableException {
		Object value = scope.get(instancePath);
		if (value == null)
			throw new UnresolvedVariableException(instancePath, null);
		return value;
	}

	/**
	 * The state of a single request. Dependencies are resolved with an explicit stack of pending instances rather than by recursion,
	 * so the depth of a dependency chain is bounded only by the node visit budget.
	 */
	private class Resolution {
		final InstanceTree theTree;
		final Selections theSelections;
		final Map<String, Object> theValues;
		final LinkedHashSet<String> theVisiting;
		final List<InstanceNode> thePending;
		int theVisits;

		Resolution(InstanceTree tree, Selections selections) {
			theTree = tree;
			theSelections = selections;
			theValues = new HashMap<>();
			theVisiting = new LinkedHashSet<>();
			thePending = new ArrayList<>();
		}

		Object resolve(InstanceNode node) throws ModelEvaluationException {
			String path = node.getInstancePath();
			if (theValues.containsKey(path))
				return theValues.get(path);
			push(node);
			while (!thePending.isEmpty()) {
				InstanceNode top = thePending.get(thePending.size() - 1);
				Object value;
				try {
					value = computeValue(top);
				} catch (PendingValue e) {
					push(e.theNode); // Resolve the dependency first, then evaluate this instance again
					continue;
				}
				theValues.put(top.getInstancePath(), value);
				theVisiting.remove(top.getInstancePath());
				thePending.remove(thePending.size() - 1);
			}
			return theValues.get(path);
		}

		/** Each instance is pushed at most once per request, so each counts once against the budget */
		private void push(InstanceNode node) throws ModelEvaluationException {
			String path = node.getInstancePath();
			if (!theVisiting.add(path))
				throw new CyclicReferenceException(cycle(path));
			if (++theVisits > theNodeVisitBudget)
				throw new ResolutionBudgetExceededException(theNodeVisitBudget, path);
			thePending.add(node);
		}

		private Object computeValue(InstanceNode node) throws ModelEvaluationException {
			DataType.Primitive type = node.getPrimitiveType();
			if (type == null)
				return null; // Class instances have no value of their own
			String path = node.getInstancePath();
			Object value;
			if (theSelections.contains(path))
				value = theSelections.get(path);
			else if (node.getValueOverride() != null) {
				InstanceOverride override = node.getValueOverride();
				value = evaluate(override.getExpression(), override.getContext());
			} else {
				ComponentDefinition component = node.getComponent();
				if (component.getDeclaredValue() == null)
					return null;
				value = evaluate(component.getDeclaredValue(), node.getEnclosingPath());
			}
			return type.coerce(value, path);
		}

		private Object evaluate(Expression expression, String context) throws ModelEvaluationException {
			return theEvaluator.evaluate(expression, new VariableLookup() {
				@Override
				public Object getValue(String reference) throws ModelEvaluationException {
					return lookup(reference, context);
				}

				@Override
				public String getContext() {
					return context.isEmpty() ? null : context;
				}
			});
		}

		/** Looks a reference up relative to the context, then to each enclosing instance, then from the root */
		private Object lookup(String reference, String context) throws ModelEvaluationException {
			for (String scope = context;; scope = Definition.parentPath(scope)) {
				InstanceNode target = theTree.getNode(Definition.childPath(scope, reference));
				if (target != null) {
					if (!theValues.containsKey(target.getInstancePath()))
						throw new PendingValue(target);
					Object value = theValues.get(target.getInstancePath());
					if (value != null)
						return value;
				}
				if (scope.isEmpty())
					break;
			}
			throw new UnresolvedVariableException(reference, context.isEmpty() ? null : context);
		}

		private List<String> cycle(String repeated) {
			List<String> chain = new ArrayList<>();
			boolean inCycle = false;
			for (String p : theVisiting) {
				if (p.equals(repeated))
					inCycle = true;
				if (inCycle)
					chain.add(p);
			}
			chain.add(repeated);
			return chain;
		}
	}

	/** Thrown out of an evaluation that needs the value of an instance not yet resolved in the request */
	private static final class PendingValue extends RuntimeException {
		final InstanceNode theNode;

		PendingValue(InstanceNode node) {
			super(node.getInstancePath(), null, false, false);
			theNode = node;
		}
	}
}
