package org.modelform.tree;

import java.util.List;
import java.util.Map;

import org.modelform.dict.ComponentDefinition;
import org.modelform.dict.DataType;
import org.modelform.dict.Definition;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * A node in an {@link InstanceTree}: one instantiated component, identified by its instance path. The root node stands for the
 * instantiated root class and has the empty instance path.
 */
public final class InstanceNode {
	private final String theInstancePath;
	private final Definition theDefinition;
	private final InstanceOverride theValueOverride;
	private final Map<String, InstanceOverride> theMemberOverrides;
	private final List<InstanceNode> theChildren;

	InstanceNode(String instancePath, Definition definition, InstanceOverride valueOverride, Map<String, InstanceOverride> memberOverrides,
		List<InstanceNode> children) {
		theInstancePath = instancePath;
		theDefinition = definition;
		theValueOverride = valueOverride;
		theMemberOverrides = ImmutableMap.copyOf(memberOverrides);
		theChildren = ImmutableList.copyOf(children);
	}

	/** @return The dot-joined component identifiers from the root to this node, or the empty string for the root */
	public String getInstancePath() {
		return theInstancePath;
	}

	/** @return The last component identifier of this node's instance path */
	public String getName() {
		return Definition.simpleName(theInstancePath);
	}

	/** @return The instance path of the instance containing this node, or the empty string for members of the root */
	public String getEnclosingPath() {
		return Definition.parentPath(theInstancePath);
	}

	/** @return Whether this is the root node of its tree */
	public boolean isRoot() {
		return theInstancePath.isEmpty();
	}

	/** @return The definition this node instantiates: a component definition for all but the root */
	public Definition getDefinition() {
		return theDefinition;
	}

	/** @return The definition of this node as a component, or null for the root */
	public ComponentDefinition getComponent() {
		return theDefinition instanceof ComponentDefinition ? (ComponentDefinition) theDefinition : null;
	}

	/** @return The primitive type of this node's value, or null if this node is not of a primitive type */
	public DataType.Primitive getPrimitiveType() {
		ComponentDefinition comp = getComponent();
		if (comp == null || !comp.getDataType().isPrimitive())
			return null;
		return (DataType.Primitive) comp.getDataType();
	}

	/** @return The value supplied for this node at an enclosing instantiation site, or null */
	public InstanceOverride getValueOverride() {
		return theValueOverride;
	}

	/** @return The overrides this node's instantiation site supplies to its members, keyed by path relative to this node */
	public Map<String, InstanceOverride> getMemberOverrides() {
		return theMemberOverrides;
	}

	/** @return This node's member instances, in declaration order */
	public List<InstanceNode> getChildren() {
		return theChildren;
	}

	@Override
	public String toString() {
		return (isRoot() ? "<root>" : theInstancePath) + ": " + theDefinition.getPath();
	}
}
