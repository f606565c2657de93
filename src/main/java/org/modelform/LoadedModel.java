package org.modelform;

import org.modelform.dict.TypeDictionary;
import org.modelform.expr.Expression;
import org.modelform.expr.ExpressionEvaluator;
import org.modelform.schema.FormSchema;
import org.modelform.schema.SchemaGenerator;
import org.modelform.scope.Scope;
import org.modelform.scope.ScopeResolver;
import org.modelform.scope.Selections;
import org.modelform.tree.InstanceNode;
import org.modelform.tree.InstanceTree;

/**
 * A model loaded by {@link ModelForm}: its type dictionary, its validated instance tree and the problems recovered from while loading
 * it. Immutable apart from its diagnostics, so it may serve concurrent evaluation requests.
 */
public class LoadedModel {
	private final InstanceTree theTree;
	private final ScopeResolver theResolver;
	private final SchemaGenerator theSchemaGenerator;
	private final Diagnostics theDiagnostics;

	LoadedModel(InstanceTree tree, ExpressionEvaluator evaluator, ModelFormConfig config, Diagnostics diagnostics) {
		theTree = tree;
		theResolver = new ScopeResolver(tree.getDictionary(), evaluator, config.getNodeVisitBudget());
		theSchemaGenerator = new SchemaGenerator(evaluator, config.isEvaluatingEnable());
		theDiagnostics = diagnostics;
	}

	/** @return The dictionary path of the root class */
	public String getRootType() {
		return theTree.getRootType();
	}

	/** @return The dictionary the model was flattened into */
	public TypeDictionary getDictionary() {
		return theTree.getDictionary();
	}

	/** @return The validated instance tree of the root class */
	public InstanceTree getTree() {
		return theTree;
	}

	/** @return The problems recorded while loading this model and by failed requests against it */
	public Diagnostics getDiagnostics() {
		return theDiagnostics;
	}

	/**
	 * @param selections The user selections, or null for none
	 * @return The resolved scope
	 * @throws ModelEvaluationException If the resolution fails
	 */
	public Scope resolve(Selections selections) throws ModelEvaluationException {
		try {
			return theResolver.resolve(theTree, selections);
		} catch (ModelEvaluationException e) {
			theDiagnostics.error(e);
			throw e;
		}
	}

	/**
	 * @param scope The resolved scope
	 * @param instancePath The instance path to get the value of
	 * @return The value at the path
	 * @throws ModelEvaluationException If the path has no value in the scope
	 */
	public Object getValue(Scope scope, String instancePath) throws ModelEvaluationException {
		return theResolver.getValue(scope, instancePath);
	}

	/**
	 * @param expression The expression to evaluate, whose references are absolute instance paths
	 * @param scope The resolved scope
	 * @param selections The user selections, or null for none
	 * @return The value of the expression
	 * @throws ModelEvaluationException If the expression cannot be evaluated
	 */
	public Object evaluate(Expression expression, Scope scope, Selections selections) throws ModelEvaluationException {
		try {
			return theResolver.getEvaluator().evaluate(expression, scope, selections);
		} catch (ModelEvaluationException e) {
			theDiagnostics.error(e);
			throw e;
		}
	}

	/**
	 * @param instancePath The instance path of the component
	 * @param scope The resolved scope
	 * @param selections The user selections, or null for none
	 * @return Whether the component is enabled
	 * @throws ModelEvaluationException If the instance does not exist or its enable condition cannot be evaluated
	 */
	public boolean isEnabled(String instancePath, Scope scope, Selections selections) throws ModelEvaluationException {
		InstanceNode node = theTree.getNode(instancePath);
		if (node == null || node.isRoot())
			throw new UnresolvedVariableException(instancePath, null);
		try {
			return theResolver.getEvaluator().evaluateCondition(node.getComponent().getEnableExpression(),
				scope.lookup(node.getEnclosingPath(), selections));
		} catch (ModelEvaluationException e) {
			theDiagnostics.error(e);
			throw e;
		}
	}

	/**
	 * Resolves the scope for the selections and generates the form schema from it
	 *
	 * @param selections The user selections, or null for none
	 * @return The schema
	 * @throws ModelEvaluationException If the resolution or an enable condition fails
	 */
	public FormSchema generateSchema(Selections selections) throws ModelEvaluationException {
		Scope scope = resolve(selections);
		try {
			return theSchemaGenerator.generate(theTree, scope, selections);
		} catch (ModelEvaluationException e) {
			theDiagnostics.error(e);
			throw e;
		}
	}

	@Override
	public String toString() {
		return theTree.toString();
	}
}
