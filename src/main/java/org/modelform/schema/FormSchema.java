package org.modelform.schema;

import java.util.List;

import com.google.common.collect.ImmutableList;

/** The form schema of a root class: its member nodes, in declaration order */
public final class FormSchema {
	private final String theRootType;
	private final String theDescription;
	private final List<SchemaNode> theNodes;

	/**
	 * @param rootType The dictionary path of the root class
	 * @param description The label text of the root class, or null
	 * @param nodes The nodes of the root's members
	 */
	public FormSchema(String rootType, String description, List<SchemaNode> nodes) {
		theRootType = rootType;
		theDescription = description;
		theNodes = ImmutableList.copyOf(nodes);
	}

	public String getRootType() {
		return theRootType;
	}

	public String getDescription() {
		return theDescription;
	}

	public List<SchemaNode> getNodes() {
		return theNodes;
	}

	/**
	 * @param instancePath The instance path of the node to find
	 * @return The node at the given path anywhere in this schema, or null if there is none
	 */
	public SchemaNode find(String instancePath) {
		return find(theNodes, instancePath);
	}

	private static SchemaNode find(List<SchemaNode> nodes, String instancePath) {
		for (SchemaNode node : nodes) {
			if (node.getPath().equals(instancePath))
				return node;
			else if (instancePath.startsWith(node.getPath() + ".")) {
				SchemaNode found = find(node.getChildNodes(), instancePath);
				if (found != null)
					return found;
			}
		}
		return null;
	}

	@Override
	public int hashCode() {
		return theRootType.hashCode() * 31 + theNodes.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof FormSchema))
			return false;
		FormSchema other = (FormSchema) obj;
		return theRootType.equals(other.theRootType) && theNodes.equals(other.theNodes);
	}

	@Override
	public String toString() {
		return theRootType + theNodes;
	}
}
