package org.modelform.tree;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import org.modelform.dict.TypeDictionary;

import com.google.common.collect.ImmutableMap;

/** A validated, immutable tree of the component instances reachable from a root class */
public final class InstanceTree {
	private final String theRootType;
	private final TypeDictionary theDictionary;
	private final InstanceNode theRoot;
	private final ImmutableMap<String, InstanceNode> theNodes;

	InstanceTree(String rootType, TypeDictionary dictionary, InstanceNode root) {
		theRootType = rootType;
		theDictionary = dictionary;
		theRoot = root;
		Map<String, InstanceNode> nodes = new LinkedHashMap<>();
		index(root, nodes);
		theNodes = ImmutableMap.copyOf(nodes);
	}

	private static void index(InstanceNode node, Map<String, InstanceNode> nodes) {
		if (!node.isRoot())
			nodes.putIfAbsent(node.getInstancePath(), node);
		for (InstanceNode child : node.getChildren())
			index(child, nodes);
	}

	/** @return The dictionary path of the root class */
	public String getRootType() {
		return theRootType;
	}

	/** @return The dictionary this tree was built from */
	public TypeDictionary getDictionary() {
		return theDictionary;
	}

	/** @return The root node */
	public InstanceNode getRoot() {
		return theRoot;
	}

	/**
	 * @param instancePath The instance path of the node
	 * @return The node at the given path, or null if there is none
	 */
	public InstanceNode getNode(String instancePath) {
		if (instancePath == null || instancePath.isEmpty())
			return theRoot;
		return theNodes.get(instancePath);
	}

	/** @return All nodes but the root, in pre-order */
	public Collection<InstanceNode> getNodes() {
		return theNodes.values();
	}

	/** @return The number of nodes in this tree, not counting the root */
	public int size() {
		return theNodes.size();
	}

	@Override
	public String toString() {
		return theRootType + theNodes.keySet();
	}
}
