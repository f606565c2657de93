package org.modelform.schema;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.modelform.ModelEvaluationException;
import org.modelform.dict.ComponentDefinition;
import org.modelform.expr.ExpressionEvaluator;
import org.modelform.scope.Scope;
import org.modelform.scope.Selections;
import org.modelform.tree.InstanceNode;
import org.modelform.tree.InstanceTree;

/**
 * Generates the {@link FormSchema} of an instance tree from its resolved {@link Scope}. Enable conditions are either evaluated
 * against the scope for every node, or written out as expression text for every node.
 */
public class SchemaGenerator {
	private static final Logger LOGGER = LogManager.getLogger(SchemaGenerator.class);

	private final ExpressionEvaluator theEvaluator;
	private final boolean isEvaluatingEnable;

	/**
	 * @param evaluator The evaluator for enable conditions
	 * @param evaluateEnable Whether to evaluate enable conditions, or to leave them as expressions for the consumer
	 */
	public SchemaGenerator(ExpressionEvaluator evaluator, boolean evaluateEnable) {
		theEvaluator = evaluator;
		isEvaluatingEnable = evaluateEnable;
	}

	/** Creates a generator that evaluates enable conditions with the standard evaluator */
	public SchemaGenerator() {
		this(ExpressionEvaluator.STANDARD, true);
	}

	/** @return Whether this generator evaluates enable conditions */
	public boolean isEvaluatingEnable() {
		return isEvaluatingEnable;
	}

	/**
	 * @param tree The instance tree
	 * @param scope The scope resolved for the tree
	 * @param selections The selections the scope was resolved with, or null for none
	 * @return The schema
	 * @throws ModelEvaluationException If an enable condition cannot be evaluated
	 */
	public FormSchema generate(InstanceTree tree, Scope scope, Selections selections) throws ModelEvaluationException {
		List<SchemaNode> nodes = generate(tree.getRoot().getChildren(), scope, selections);
		LOGGER.debug("Generated schema of {} with {} top-level nodes", tree.getRootType(), nodes.size());
		return new FormSchema(tree.getRootType(), tree.getRoot().getDefinition().getDescription(), nodes);
	}

	private List<SchemaNode> generate(List<InstanceNode> instances, Scope scope, Selections selections) throws ModelEvaluationException {
		List<SchemaNode> nodes = new ArrayList<>(instances.size());
		for (InstanceNode instance : instances) {
			ComponentDefinition component = instance.getComponent();
			Object enable;
			// Enable conditions are written in the declaring class, so they refer to its instance's members
			if (isEvaluatingEnable)
				enable = theEvaluator.evaluateCondition(component.getEnableExpression(),
					scope.lookup(instance.getEnclosingPath(), selections));
			else
				enable = component.getEnableExpression().toString();
			nodes.add(new SchemaNode(instance.getInstancePath(), component.getDataType().getName(), scope.get(instance.getInstancePath()),
				enable, component.getDescription(), generate(instance.getChildren(), scope, selections)));
		}
		return nodes;
	}
}
